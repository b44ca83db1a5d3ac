package taskwarden.coordinator.repository;

import taskwarden.coordinator.model.MetricsSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RecordingMetricsRepository implements MetricsRepository {

    private final List<MetricsSnapshot> rows = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void append(MetricsSnapshot snapshot) {
        rows.add(snapshot);
    }

    @Override
    public List<MetricsSnapshot> findRecent(int limit) {
        synchronized (rows) {
            List<MetricsSnapshot> newestFirst = new ArrayList<>(rows);
            Collections.reverse(newestFirst);
            return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
        }
    }

    public int size() {
        return rows.size();
    }
}

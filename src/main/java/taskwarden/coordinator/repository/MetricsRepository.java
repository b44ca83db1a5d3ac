package taskwarden.coordinator.repository;

import taskwarden.coordinator.model.MetricsSnapshot;

import java.util.List;

/**
 * Append-only store for the system metrics time series.
 */
public interface MetricsRepository {

    void append(MetricsSnapshot snapshot);

    /**
     * Latest snapshots, newest first.
     */
    List<MetricsSnapshot> findRecent(int limit);
}

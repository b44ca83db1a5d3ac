package taskwarden.coordinator.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.model.Task;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local queue used when the shared store is unavailable.
 * Entries are lost when the process exits and are invisible to other processes.
 */
public final class InMemoryPriorityTaskQueue implements PriorityTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPriorityTaskQueue.class);

    private record Entry(Task task, double score, long seq, Instant availableAt) {
    }

    private record CachedResult(String json, Instant expiresAt) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final PriorityQueue<Entry> ready = new PriorityQueue<>(
            Comparator.comparingDouble(Entry::score).thenComparingLong(Entry::seq));
    private final PriorityQueue<Entry> delayed = new PriorityQueue<>(
            Comparator.comparing(Entry::availableAt).thenComparingLong(Entry::seq));
    private final Map<String, Entry> byId = new HashMap<>();
    private final Map<String, CachedResult> results = new ConcurrentHashMap<>();

    private long nextSeq = 0;

    @Override
    public boolean put(Task task) {
        Instant now = Instant.now();
        lock.lock();
        try {
            if (byId.containsKey(task.id())) {
                log.warn("Task {} is already queued", task.id());
                return false;
            }
            Instant availableAt = task.scheduledTime() != null ? task.scheduledTime() : now;
            Entry entry = new Entry(task, QueueScore.of(task.priority(), now), nextSeq++, availableAt);
            byId.put(task.id(), entry);
            if (task.isDue(now)) {
                ready.add(entry);
            } else {
                delayed.add(entry);
            }
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Task> get(Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                promoteDue(Instant.now());

                Entry head = ready.poll();
                if (head != null) {
                    byId.remove(head.task().id());
                    return Optional.of(head.task());
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }

                long wait = remaining;
                Entry nextDelayed = delayed.peek();
                if (nextDelayed != null) {
                    long untilDue = Duration.between(Instant.now(), nextDelayed.availableAt()).toNanos();
                    wait = Math.max(TimeUnit.MILLISECONDS.toNanos(1), Math.min(wait, untilDue));
                }
                long before = System.nanoTime();
                changed.awaitNanos(wait);
                remaining -= System.nanoTime() - before;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private void promoteDue(Instant now) {
        Entry next;
        while ((next = delayed.peek()) != null && !next.availableAt().isAfter(now)) {
            ready.add(delayed.poll());
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return byId.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String taskId) {
        lock.lock();
        try {
            Entry entry = byId.remove(taskId);
            if (entry == null) {
                return false;
            }
            if (!ready.remove(entry)) {
                delayed.remove(entry);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setResult(String taskId, String resultJson, Duration ttl) {
        results.put(taskId, new CachedResult(resultJson, Instant.now().plus(ttl)));
    }

    @Override
    public Optional<String> getResult(String taskId) {
        CachedResult cached = results.get(taskId);
        if (cached == null) {
            return Optional.empty();
        }
        if (!cached.expiresAt().isAfter(Instant.now())) {
            results.remove(taskId, cached);
            return Optional.empty();
        }
        return Optional.ofNullable(cached.json());
    }

    @Override
    public int purgeExpiredResults() {
        Instant now = Instant.now();
        int removed = 0;
        Iterator<CachedResult> it = results.values().iterator();
        while (it.hasNext()) {
            if (!it.next().expiresAt().isAfter(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public boolean isShared() {
        return false;
    }
}

package taskwarden.coordinator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the worker threads of one supervisor.
 * Scale-down drains the most recently started workers; a worker whose thread
 * ended without being asked to stop counts as dead until pruned.
 */
public final class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private record WorkerHandle(Worker worker, Thread thread, Instant startedAt) {

        boolean isLive() {
            return thread.isAlive() && !worker.isStopRequested();
        }

        boolean isDead() {
            return !thread.isAlive() && !worker.isStopRequested();
        }
    }

    private final String nodeId;
    private final Function<String, Worker> workerFactory;
    private final AtomicInteger sequence = new AtomicInteger();

    private final List<WorkerHandle> workers = new ArrayList<>();
    private final List<WorkerHandle> draining = new ArrayList<>();

    /**
     * @param nodeId        prefix of every worker id, identifies this supervisor
     * @param workerFactory creates a worker for a given worker id
     */
    public WorkerPool(String nodeId, Function<String, Worker> workerFactory) {
        this.nodeId = nodeId;
        this.workerFactory = workerFactory;
    }

    public synchronized void scaleUp(int count) {
        for (int i = 0; i < count; i++) {
            String workerId = nodeId + "-worker-" + sequence.incrementAndGet();
            Worker worker = workerFactory.apply(workerId);
            Thread thread = new Thread(worker, workerId);
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) -> log.error("Worker {} crashed", workerId, e));
            thread.start();
            workers.add(new WorkerHandle(worker, thread, Instant.now()));
        }
        if (count > 0) {
            log.info("Started {} worker(s), {} live", count, liveCount());
        }
    }

    /**
     * Ask the {@code count} most recently started live workers to exit after their current task.
     */
    public synchronized void scaleDown(int count) {
        int stopped = 0;
        for (int i = workers.size() - 1; i >= 0 && stopped < count; i--) {
            WorkerHandle handle = workers.get(i);
            if (!handle.isLive()) {
                continue;
            }
            handle.worker().requestStop();
            workers.remove(i);
            draining.add(handle);
            stopped++;
        }
        if (stopped > 0) {
            log.info("Draining {} worker(s), {} live", stopped, liveCount());
        }
        pruneDrained();
    }

    /**
     * Resize to exactly {@code target} live workers.
     *
     * @return change in live workers, negative when scaling down
     */
    public synchronized int scaleTo(int target) {
        int live = liveCount();
        if (target > live) {
            scaleUp(target - live);
        } else if (target < live) {
            scaleDown(live - target);
        }
        return target - live;
    }

    /**
     * Forget workers that died without being asked to stop.
     *
     * @return ids of the removed workers
     */
    public synchronized List<String> pruneDead() {
        List<String> removed = new ArrayList<>();
        Iterator<WorkerHandle> it = workers.iterator();
        while (it.hasNext()) {
            WorkerHandle handle = it.next();
            if (handle.isDead()) {
                removed.add(handle.worker().workerId());
                it.remove();
            }
        }
        if (!removed.isEmpty()) {
            log.warn("Pruned {} dead worker(s): {}", removed.size(), removed);
        }
        pruneDrained();
        return removed;
    }

    private void pruneDrained() {
        draining.removeIf(handle -> !handle.thread().isAlive());
    }

    public synchronized int liveCount() {
        return (int) workers.stream().filter(WorkerHandle::isLive).count();
    }

    public synchronized int deadCount() {
        return (int) workers.stream().filter(WorkerHandle::isDead).count();
    }

    public synchronized int drainingCount() {
        pruneDrained();
        return draining.size();
    }

    /** Whether the worker with this id has a running thread (live or draining). */
    public synchronized boolean isRunning(String workerId) {
        return workers.stream().anyMatch(h -> h.worker().workerId().equals(workerId) && h.thread().isAlive())
                || draining.stream().anyMatch(h -> h.worker().workerId().equals(workerId) && h.thread().isAlive());
    }

    /** Whether the id was issued by this pool. */
    public boolean owns(String workerId) {
        return workerId != null && workerId.startsWith(nodeId + "-worker-");
    }

    public synchronized Set<String> liveWorkerIds() {
        return workers.stream()
                .filter(WorkerHandle::isLive)
                .map(h -> h.worker().workerId())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public String nodeId() {
        return nodeId;
    }

    /**
     * Drain every worker, wait up to {@code grace}, interrupt the stragglers and wait once more.
     *
     * @return number of worker threads still alive afterwards
     */
    public int stopAll(Duration grace) {
        List<WorkerHandle> all;
        synchronized (this) {
            all = new ArrayList<>(workers);
            all.addAll(draining);
            workers.clear();
            draining.clear();
        }

        all.forEach(h -> h.worker().requestStop());
        join(all, grace);

        List<WorkerHandle> stragglers = all.stream().filter(h -> h.thread().isAlive()).toList();
        if (!stragglers.isEmpty()) {
            log.warn("Interrupting {} worker(s) that did not finish within {}s", stragglers.size(), grace.toSeconds());
            stragglers.forEach(h -> h.thread().interrupt());
            join(stragglers, grace);
        }

        List<String> alive = all.stream()
                .filter(h -> h.thread().isAlive())
                .map(h -> h.worker().workerId())
                .toList();
        if (!alive.isEmpty()) {
            log.error("Workers still running after shutdown: {}", alive);
        } else {
            log.info("All {} worker(s) stopped", all.size());
        }
        return alive.size();
    }

    private static void join(List<WorkerHandle> handles, Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        for (WorkerHandle handle : handles) {
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0) {
                return;
            }
            try {
                handle.thread().join(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}

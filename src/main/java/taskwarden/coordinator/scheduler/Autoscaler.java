package taskwarden.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.worker.WorkerPool;

/**
 * Periodically resizes the worker pool to the monitor's recommendation,
 * capped at {@code maxWorkers}.
 */
public class Autoscaler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Autoscaler.class);

    private final ResourceMonitor monitor;
    private final WorkerPool pool;
    private final CoordinatorConfig config;

    public Autoscaler(ResourceMonitor monitor, WorkerPool pool, CoordinatorConfig config) {
        this.monitor = monitor;
        this.pool = pool;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            rebalance();
        } catch (Exception e) {
            log.error("Autoscaler error", e);
        }
    }

    /**
     * Record a resource sample, drop dead workers and move the live count to the target.
     *
     * @return change in live workers
     */
    public int rebalance() {
        monitor.recordSample();
        pool.pruneDead();

        int target = Math.max(1, Math.min(monitor.recommendedWorkerCount(), config.maxWorkers()));
        int live = pool.liveCount();
        if (target == live) {
            return 0;
        }

        int delta = pool.scaleTo(target);
        if (delta > 0) {
            log.info("Scaled up from {} to {} workers", live, target);
        } else {
            log.info("Scaled down from {} to {} workers", live, target);
        }
        return delta;
    }
}

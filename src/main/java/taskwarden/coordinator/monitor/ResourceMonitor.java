package taskwarden.coordinator.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.config.CoordinatorConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Samples host CPU, memory and disk usage and turns them into two decisions:
 * whether workers should pause, and how many workers the host can carry.
 *
 * Samples are cached for a short TTL so that many workers asking
 * {@link #shouldThrottle()} hit the probe at most once per TTL.
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final SystemProbe probe;
    private final double cpuThreshold;
    private final double memoryThreshold;
    private final double cpuScaleDownThreshold;
    private final double memoryScaleDownThreshold;
    private final int recommendedMax;
    private final Duration cacheTtl;
    private final int historySize;

    private final Deque<ResourceSnapshot> history = new ArrayDeque<>();
    private ResourceSnapshot cached;
    private Instant cachedAt = Instant.EPOCH;

    public ResourceMonitor(SystemProbe probe, CoordinatorConfig config) {
        this.probe = probe;
        this.cpuThreshold = config.cpuThreshold();
        this.memoryThreshold = config.memoryThreshold();
        this.cpuScaleDownThreshold = config.cpuScaleDownThreshold();
        this.memoryScaleDownThreshold = config.memoryScaleDownThreshold();
        this.recommendedMax = Math.max(1, config.recommendedMax());
        this.cacheTtl = config.sampleCacheTtl();
        this.historySize = Math.max(1, config.historySize());
    }

    /**
     * Current resource usage, at most {@code sampleCacheTtl} old.
     * A failing probe yields the last good sample, or an all-zero one before the first success.
     */
    public synchronized ResourceSnapshot sample() {
        Instant now = Instant.now();
        if (cached != null && Duration.between(cachedAt, now).compareTo(cacheTtl) < 0) {
            return cached;
        }
        try {
            cached = probe.sample();
            cachedAt = now;
        } catch (RuntimeException e) {
            log.warn("Resource probe failed: {}", e.getMessage());
            if (cached == null) {
                return new ResourceSnapshot(now, 0, 0, 0, 0, 0, 0, 0);
            }
        }
        return cached;
    }

    /**
     * True when CPU or memory is above its throttle threshold.
     */
    public boolean shouldThrottle() {
        ResourceSnapshot s = sample();
        return s.cpuPercent() > cpuThreshold || s.memoryPercent() > memoryThreshold;
    }

    /**
     * Worker count the host can sustain right now, always within {@code [1, recommendedMax]}.
     */
    public int recommendedWorkerCount() {
        ResourceSnapshot s = sample();
        return recommend(s.cpuPercent(), s.memoryPercent(), probe.cpuCount());
    }

    int recommend(double cpuPercent, double memoryPercent, int cores) {
        int count;
        if (cpuPercent > cpuScaleDownThreshold) {
            count = Math.max(1, cores / 2);
        } else if (memoryPercent > memoryScaleDownThreshold) {
            count = Math.max(1, cores / 3);
        } else {
            count = Math.min(cores - 1, recommendedMax);
        }
        return Math.max(1, Math.min(count, recommendedMax));
    }

    /**
     * Append the current sample to the bounded history and log it.
     */
    public synchronized ResourceSnapshot recordSample() {
        ResourceSnapshot s = sample();
        history.addLast(s);
        while (history.size() > historySize) {
            history.removeFirst();
        }
        log.info("Resources: cpu={}% memory={}% available={}GB load={} disk={}% free={}GB processes={}",
                round(s.cpuPercent()), round(s.memoryPercent()), round(s.memoryAvailableGb()),
                round(s.loadAverage()), round(s.diskPercent()), round(s.diskFreeGb()), s.processCount());
        return s;
    }

    public synchronized List<ResourceSnapshot> history() {
        return List.copyOf(history);
    }

    public int cpuCount() {
        return probe.cpuCount();
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}

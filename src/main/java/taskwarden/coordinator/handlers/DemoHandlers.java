package taskwarden.coordinator.handlers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskwarden.coordinator.monitor.ResourceMonitor;
import taskwarden.coordinator.monitor.ResourceSnapshot;
import taskwarden.coordinator.worker.HandlerRegistry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Demonstration handlers used by the {@code example} command.
 * Each one simulates work with a random sleep and returns a small JSON-friendly map.
 */
public final class DemoHandlers {

    private static final Logger log = LoggerFactory.getLogger(DemoHandlers.class);

    private final ResourceMonitor monitor;
    private final double delayScale;

    /**
     * @param delayScale multiplier for the simulated work time, 0 to run instantly
     */
    public DemoHandlers(ResourceMonitor monitor, double delayScale) {
        if (delayScale < 0) {
            throw new IllegalArgumentException("delayScale must be >= 0");
        }
        this.monitor = monitor;
        this.delayScale = delayScale;
    }

    public DemoHandlers(ResourceMonitor monitor) {
        this(monitor, 1.0);
    }

    public HandlerRegistry registerAll(HandlerRegistry registry) {
        return registry
                .register("system_health_check", (args, kwargs) -> healthCheck())
                .register("market_data_fetch", (args, kwargs) -> marketData(kwargs))
                .register("content_generation", (args, kwargs) -> contentGeneration(kwargs))
                .register("telegram_post", (args, kwargs) -> telegramPost(kwargs))
                .register("analytics_update", (args, kwargs) -> analyticsUpdate())
                .register("database_cleanup", (args, kwargs) -> databaseCleanup())
                .register("noop_success", (args, kwargs) -> Map.of("ok", true))
                .register("always_fail", (args, kwargs) -> {
                    throw new IllegalStateException("always_fail handler invoked");
                });
    }

    private Map<String, Object> healthCheck() {
        ResourceSnapshot stats = monitor.sample();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("system_healthy", !monitor.shouldThrottle());
        result.put("cpu_percent", stats.cpuPercent());
        result.put("memory_percent", stats.memoryPercent());
        result.put("disk_percent", stats.diskPercent());
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    private Map<String, Object> marketData(Map<String, Object> kwargs) throws InterruptedException {
        simulateWork(500, 2000);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("symbol", kwargs.getOrDefault("symbol", "NIFTY"));
        result.put("price", random.nextDouble(18000, 19000));
        result.put("change", random.nextDouble(-100, 100));
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    private Map<String, Object> contentGeneration(Map<String, Object> kwargs) throws InterruptedException {
        simulateWork(1000, 3000);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", "Generated content for " + kwargs.getOrDefault("topic", "finance"));
        result.put("word_count", ThreadLocalRandom.current().nextInt(100, 501));
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    private Map<String, Object> telegramPost(Map<String, Object> kwargs) throws InterruptedException {
        simulateWork(1000, 4000);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("channel", kwargs.getOrDefault("channel", "@taskwarden"));
        result.put("message_id", ThreadLocalRandom.current().nextInt(1000, 10000));
        result.put("status", "posted");
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    private Map<String, Object> analyticsUpdate() throws InterruptedException {
        simulateWork(500, 1500);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("metrics_updated", List.of("views", "subscribers", "engagement"));
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    private Map<String, Object> databaseCleanup() throws InterruptedException {
        simulateWork(2000, 5000);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("tables_cleaned", List.of("old_sessions", "temp_data"));
        result.put("records_deleted", ThreadLocalRandom.current().nextInt(10, 101));
        result.put("timestamp", Instant.now().toString());
        return result;
    }

    private void simulateWork(int minMs, int maxMs) throws InterruptedException {
        long delay = Math.round(ThreadLocalRandom.current().nextInt(minMs, maxMs) * delayScale);
        if (delay > 0) {
            log.debug("Simulating {}ms of work on {}", delay, Thread.currentThread().getName());
            Thread.sleep(delay);
        }
    }
}

package taskwarden.coordinator.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration holder for the scheduler.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    /** Where the priority queue lives. */
    public enum QueueBackend {
        /** Shared H2 tables, visible to every process on the host */
        JDBC,
        /** Process-local heap, lost on exit */
        MEMORY
    }

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskwarden;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Queue settings
    private QueueBackend queueBackend = QueueBackend.JDBC;
    private String queueDatabaseUrl = null; // null = same database as the task store
    private Duration queuePollInterval = Duration.ofMillis(100);
    private Duration resultTtl = Duration.ofHours(1);

    // Resource thresholds (percent)
    private double cpuThreshold = 90.0;
    private double memoryThreshold = 85.0;
    private double cpuScaleDownThreshold = 80.0;
    private double memoryScaleDownThreshold = 75.0;
    private int recommendedMax = 8;
    private Duration sampleCacheTtl = Duration.ofSeconds(1);
    private int historySize = 1000;
    private String diskPath = "/";

    // Worker settings
    private int maxWorkers = 12;
    private Duration pollTimeout = Duration.ofSeconds(1); // short so draining workers notice the stop flag
    private Duration throttleBackoff = Duration.ofSeconds(5);
    private Duration retryBackoff = Duration.ofSeconds(30);
    private Duration interTaskPause = Duration.ofMillis(100);
    private boolean enforceTimeouts = true;
    private Duration shutdownGrace = Duration.ofSeconds(5);

    // Task defaults
    private int defaultMaxRetries = 3;
    private int defaultTimeoutSeconds = 300;

    // Background loops
    private Duration autoscaleInterval = Duration.ofSeconds(30);
    private Duration metricsInterval = Duration.ofSeconds(60);
    private Duration taskReaperInterval = Duration.ofSeconds(30);
    private Duration taskStuckThreshold = Duration.ofMinutes(10);
    private Duration throughputWindow = Duration.ofMinutes(5);

    // Server settings
    private int serverPort = 0; // 0 = HTTP API disabled
    private String serverHost = "0.0.0.0";

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("TASKWARDEN_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String backend = System.getenv("TASKWARDEN_QUEUE_BACKEND");
        if (backend != null && !backend.isBlank()) {
            config.queueBackend = QueueBackend.valueOf(backend.trim().toUpperCase(Locale.ROOT));
        }

        String queueUrl = System.getenv("TASKWARDEN_QUEUE_DB_URL");
        if (queueUrl != null && !queueUrl.isBlank()) {
            config.queueDatabaseUrl = queueUrl;
        }

        String maxWorkers = System.getenv("TASKWARDEN_MAX_WORKERS");
        if (maxWorkers != null && !maxWorkers.isBlank()) {
            config.maxWorkers = Integer.parseInt(maxWorkers.trim());
        }

        String recommendedMax = System.getenv("TASKWARDEN_RECOMMENDED_MAX");
        if (recommendedMax != null && !recommendedMax.isBlank()) {
            config.recommendedMax = Integer.parseInt(recommendedMax.trim());
        }

        String cpu = System.getenv("TASKWARDEN_CPU_THRESHOLD");
        if (cpu != null && !cpu.isBlank()) {
            config.cpuThreshold = Double.parseDouble(cpu.trim());
        }

        String memory = System.getenv("TASKWARDEN_MEMORY_THRESHOLD");
        if (memory != null && !memory.isBlank()) {
            config.memoryThreshold = Double.parseDouble(memory.trim());
        }

        String port = System.getenv("TASKWARDEN_HTTP_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String maxRetries = System.getenv("TASKWARDEN_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.defaultMaxRetries = Integer.parseInt(maxRetries.trim());
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public QueueBackend queueBackend() {
        return queueBackend;
    }

    /** JDBC URL of the shared queue; falls back to the task store URL. */
    public String queueDatabaseUrl() {
        return queueDatabaseUrl != null ? queueDatabaseUrl : databaseUrl;
    }

    public boolean hasSeparateQueueDatabase() {
        return queueDatabaseUrl != null && !queueDatabaseUrl.equals(databaseUrl);
    }

    public Duration queuePollInterval() {
        return queuePollInterval;
    }

    public Duration resultTtl() {
        return resultTtl;
    }

    public double cpuThreshold() {
        return cpuThreshold;
    }

    public double memoryThreshold() {
        return memoryThreshold;
    }

    public double cpuScaleDownThreshold() {
        return cpuScaleDownThreshold;
    }

    public double memoryScaleDownThreshold() {
        return memoryScaleDownThreshold;
    }

    public int recommendedMax() {
        return recommendedMax;
    }

    public Duration sampleCacheTtl() {
        return sampleCacheTtl;
    }

    public int historySize() {
        return historySize;
    }

    public String diskPath() {
        return diskPath;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public Duration pollTimeout() {
        return pollTimeout;
    }

    public Duration throttleBackoff() {
        return throttleBackoff;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public Duration interTaskPause() {
        return interTaskPause;
    }

    public boolean enforceTimeouts() {
        return enforceTimeouts;
    }

    public Duration shutdownGrace() {
        return shutdownGrace;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public int defaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public Duration autoscaleInterval() {
        return autoscaleInterval;
    }

    public Duration metricsInterval() {
        return metricsInterval;
    }

    public Duration taskReaperInterval() {
        return taskReaperInterval;
    }

    public Duration taskStuckThreshold() {
        return taskStuckThreshold;
    }

    public Duration throughputWindow() {
        return throughputWindow;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public boolean httpEnabled() {
        return serverPort > 0;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withQueueBackend(QueueBackend backend) {
        this.queueBackend = backend;
        return this;
    }

    public CoordinatorConfig withQueueDatabaseUrl(String url) {
        this.queueDatabaseUrl = url;
        return this;
    }

    public CoordinatorConfig withQueuePollInterval(Duration interval) {
        this.queuePollInterval = interval;
        return this;
    }

    public CoordinatorConfig withResultTtl(Duration ttl) {
        this.resultTtl = ttl;
        return this;
    }

    public CoordinatorConfig withCpuThreshold(double percent) {
        this.cpuThreshold = percent;
        return this;
    }

    public CoordinatorConfig withMemoryThreshold(double percent) {
        this.memoryThreshold = percent;
        return this;
    }

    public CoordinatorConfig withRecommendedMax(int max) {
        this.recommendedMax = max;
        return this;
    }

    public CoordinatorConfig withSampleCacheTtl(Duration ttl) {
        this.sampleCacheTtl = ttl;
        return this;
    }

    public CoordinatorConfig withHistorySize(int size) {
        this.historySize = size;
        return this;
    }

    public CoordinatorConfig withMaxWorkers(int max) {
        this.maxWorkers = max;
        return this;
    }

    public CoordinatorConfig withPollTimeout(Duration timeout) {
        this.pollTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withThrottleBackoff(Duration backoff) {
        this.throttleBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withInterTaskPause(Duration pause) {
        this.interTaskPause = pause;
        return this;
    }

    public CoordinatorConfig withEnforceTimeouts(boolean enforce) {
        this.enforceTimeouts = enforce;
        return this;
    }

    public CoordinatorConfig withShutdownGrace(Duration grace) {
        this.shutdownGrace = grace;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public CoordinatorConfig withDefaultTimeoutSeconds(int seconds) {
        this.defaultTimeoutSeconds = seconds;
        return this;
    }

    public CoordinatorConfig withAutoscaleInterval(Duration interval) {
        this.autoscaleInterval = interval;
        return this;
    }

    public CoordinatorConfig withMetricsInterval(Duration interval) {
        this.metricsInterval = interval;
        return this;
    }

    public CoordinatorConfig withTaskReaperInterval(Duration interval) {
        this.taskReaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withTaskStuckThreshold(Duration threshold) {
        this.taskStuckThreshold = threshold;
        return this;
    }

    public CoordinatorConfig withThroughputWindow(Duration window) {
        this.throughputWindow = window;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", queueBackend=" + queueBackend +
                ", maxWorkers=" + maxWorkers +
                ", recommendedMax=" + recommendedMax +
                ", cpuThreshold=" + cpuThreshold +
                ", memoryThreshold=" + memoryThreshold +
                ", retryBackoff=" + retryBackoff +
                ", serverPort=" + serverPort +
                '}';
    }
}

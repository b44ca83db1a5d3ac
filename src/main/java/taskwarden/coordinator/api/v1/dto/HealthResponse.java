package taskwarden.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("activeWorkers") Integer activeWorkers,
        @JsonProperty("queueSize") Integer queueSize,
        @JsonProperty("queueShared") Boolean queueShared,
        @JsonProperty("throttling") Boolean throttling) {

    public static HealthResponse healthy(String uptime, String version, int activeWorkers, int queueSize,
            boolean queueShared, boolean throttling) {
        return new HealthResponse("healthy", "ok", uptime, version, activeWorkers, queueSize, queueShared,
                throttling);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}

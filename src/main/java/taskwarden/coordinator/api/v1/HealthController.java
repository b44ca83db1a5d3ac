package taskwarden.coordinator.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskwarden.coordinator.api.Controller;
import taskwarden.coordinator.api.v1.dto.HealthResponse;
import taskwarden.coordinator.core.DistributedTaskManager;
import taskwarden.coordinator.server.RouterHandler;
import taskwarden.coordinator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final DistributedTaskManager manager;

    public HealthController(Database database, DistributedTaskManager manager) {
        this.database = database;
        this.manager = manager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    manager.workerPool().liveCount(),
                    manager.queue().size(),
                    manager.queue().isShared(),
                    manager.monitor().shouldThrottle());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return unhealthy(e.getMessage());
        }
    }

    private ControllerResponse unhealthy(String reason) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
        } catch (Exception e) {
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}

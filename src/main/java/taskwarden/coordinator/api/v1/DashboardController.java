package taskwarden.coordinator.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskwarden.coordinator.api.Controller;
import taskwarden.coordinator.core.DistributedTaskManager;
import taskwarden.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Read-only operational views.
 *
 * GET /api/v1/dashboard - current dashboard stats
 * GET /api/v1/metrics?limit=N - most recent system_metrics rows, newest first
 */
public class DashboardController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    static final int DEFAULT_METRICS_LIMIT = 60;
    static final int MAX_METRICS_LIMIT = 1000;

    private final DistributedTaskManager manager;

    public DashboardController(DistributedTaskManager manager) {
        this.manager = manager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/dashboard".equals(path) || "/api/v1/metrics".equals(path));
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if ("/api/v1/dashboard".equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(manager.getDashboardStats()));
            }
            int limit = parseLimit(new QueryStringDecoder(req.uri()).parameters().get("limit"));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(manager.recentMetrics(limit)));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Dashboard controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    static int parseLimit(List<String> values) {
        if (values == null || values.isEmpty()) {
            return DEFAULT_METRICS_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_METRICS_LIMIT);
    }
}

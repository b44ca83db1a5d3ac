package taskwarden.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskwarden.coordinator.api.Controller;
import taskwarden.coordinator.api.v1.dto.SubmitTaskRequest;
import taskwarden.coordinator.api.v1.dto.TaskResponse;
import taskwarden.coordinator.core.DistributedTaskManager;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskStatus;
import taskwarden.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task submission and lookup (public API).
 *
 * POST /api/v1/tasks - Submit a task
 * GET /api/v1/tasks?limit=N - Most recently updated tasks, newest first
 * GET /api/v1/tasks/{taskId} - Get task status and result
 * DELETE /api/v1/tasks/{taskId} - Cancel a task that is still queued
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final DistributedTaskManager manager;

    public TaskController(DistributedTaskManager manager) {
        this.manager = manager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET) && TASKS_PATTERN.matcher(path).matches()) {
            return true;
        }
        if (method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleSubmit(req);
            }
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher matcher = TASK_BY_ID_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown task endpoint");
            }
            String taskId = matcher.group(1);
            if (req.method().equals(HttpMethod.DELETE)) {
                return handleCancel(taskId);
            }
            return handleGet(taskId);

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        request.validate();

        Optional<String> taskId = manager.submitTask(
                request.name(),
                request.function(),
                request.args(),
                request.kwargs(),
                request.taskPriority(),
                request.options());

        if (taskId.isEmpty()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    "{\"success\":false,\"error\":\"task could not be queued\"}");
        }

        Map<String, Object> response = Map.of(
                "success", true,
                "taskId", taskId.get());
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/tasks?limit=N
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        int limit = DashboardController.parseLimit(new QueryStringDecoder(req.uri()).parameters().get("limit"));
        List<TaskResponse> tasks = manager.recentTasks(limit).stream()
                .map(task -> TaskResponse.from(task, task.result()))
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(tasks));
    }

    /**
     * GET /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleGet(String taskId) throws Exception {
        Optional<Task> task = manager.getTaskStatus(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        String result = task.get().status() == TaskStatus.COMPLETED
                ? manager.getTaskResult(taskId).orElse(null)
                : null;
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task.get(), result)));
    }

    /**
     * DELETE /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleCancel(String taskId) throws Exception {
        Optional<Task> task = manager.getTaskStatus(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        if (!manager.cancelTask(taskId)) {
            return ControllerResponse.conflict("task is " + task.get().status() + " and can no longer be cancelled");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "taskId", taskId, "status", TaskStatus.CANCELLED.name())));
    }
}

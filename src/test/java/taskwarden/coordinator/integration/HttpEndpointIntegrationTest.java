package taskwarden.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.monitor.StubSystemProbe;
import taskwarden.coordinator.server.RouterHandler;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP API end to end against an in-memory database.
 */
class HttpEndpointIntegrationTest {

    private static Dependencies deps;
    private static HttpClient client;
    private static String baseUrl;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withQueuePollInterval(Duration.ofMillis(20))
                .withPollTimeout(Duration.ofMillis(100))
                .withRetryBackoff(Duration.ZERO)
                .withInterTaskPause(Duration.ZERO)
                .withMaxWorkers(2);
        deps = Dependencies.create(config, StubSystemProbe.idle(4), 0);
        int port = deps.startServer(0);
        baseUrl = "http://127.0.0.1:" + port;
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterAll
    static void teardown() {
        if (deps != null)
            deps.close();
    }

    private static HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> delete(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return RouterHandler.mapper().readTree(response.body());
    }

    @Test
    @DisplayName("GET /api/v1/health reports a healthy coordinator")
    void health() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertTrue(body.get("queueShared").asBoolean());
        assertFalse(body.get("throttling").asBoolean());
    }

    @Test
    @DisplayName("POST then DELETE cancels a task while it is still queued")
    void submitAndCancel() throws Exception {
        HttpResponse<String> created = post("/api/v1/tasks",
                "{\"name\":\"Later\",\"function\":\"noop_success\",\"priority\":\"BATCH\","
                        + "\"scheduledTime\":\"2999-01-01T00:00:00Z\"}");

        assertEquals(201, created.statusCode());
        String taskId = json(created).get("taskId").asText();

        HttpResponse<String> cancelled = delete("/api/v1/tasks/" + taskId);
        assertEquals(200, cancelled.statusCode());
        assertEquals("CANCELLED", json(cancelled).get("status").asText());

        HttpResponse<String> again = delete("/api/v1/tasks/" + taskId);
        assertEquals(409, again.statusCode());

        JsonNode task = json(get("/api/v1/tasks/" + taskId));
        assertEquals("CANCELLED", task.get("status").asText());
        assertEquals("BATCH", task.get("priority").asText());
        assertEquals("2999-01-01T00:00:00Z", task.get("scheduledTime").asText());
    }

    @Test
    @DisplayName("A submitted task runs to completion and exposes its result")
    void submitAndComplete() throws Exception {
        deps.manager().start(1);
        try {
            HttpResponse<String> created = post("/api/v1/tasks",
                    "{\"name\":\"Ping\",\"function\":\"noop_success\",\"priority\":\"1\"}");
            assertEquals(201, created.statusCode());
            String taskId = json(created).get("taskId").asText();

            await().atMost(Duration.ofSeconds(10)).until(() ->
                    "COMPLETED".equals(json(get("/api/v1/tasks/" + taskId)).get("status").asText()));

            JsonNode task = json(get("/api/v1/tasks/" + taskId));
            assertEquals("CRITICAL", task.get("priority").asText());
            assertTrue(task.get("result").get("ok").asBoolean());
            assertEquals(0, task.get("retryCount").asInt());
        } finally {
            deps.manager().stop();
        }
    }

    @Test
    @DisplayName("Invalid submissions are rejected with 400")
    void badRequests() throws Exception {
        assertEquals(400, post("/api/v1/tasks", "{not json").statusCode());

        HttpResponse<String> missingName = post("/api/v1/tasks", "{\"function\":\"noop_success\"}");
        assertEquals(400, missingName.statusCode());
        assertEquals("name is required", json(missingName).get("error").asText());

        assertEquals(400, post("/api/v1/tasks",
                "{\"name\":\"x\",\"function\":\"f\",\"priority\":\"URGENT\"}").statusCode());
        assertEquals(400, post("/api/v1/tasks",
                "{\"name\":\"x\",\"function\":\"f\",\"scheduledTime\":\"tomorrow\"}").statusCode());
    }

    @Test
    @DisplayName("Unknown tasks and routes return 404")
    void notFound() throws Exception {
        assertEquals(404, get("/api/v1/tasks/does-not-exist").statusCode());
        assertEquals(404, delete("/api/v1/tasks/does-not-exist").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    @DisplayName("Dashboard and metrics endpoints return JSON")
    void dashboardAndMetrics() throws Exception {
        HttpResponse<String> dashboard = get("/api/v1/dashboard");
        assertEquals(200, dashboard.statusCode());
        JsonNode stats = json(dashboard);
        assertTrue(stats.has("system"));
        assertTrue(stats.get("tasks").has("queue_size"));
        assertEquals(10.0, stats.get("system").get("cpu_percent").asDouble());

        HttpResponse<String> metrics = get("/api/v1/metrics?limit=5");
        assertEquals(200, metrics.statusCode());
        assertTrue(json(metrics).isArray());

        assertEquals(400, get("/api/v1/metrics?limit=abc").statusCode());
    }

    @Test
    @DisplayName("GET /api/v1/tasks lists recent tasks up to the limit")
    void listTasks() throws Exception {
        HttpResponse<String> created = post("/api/v1/tasks",
                "{\"name\":\"Listed\",\"function\":\"noop_success\","
                        + "\"scheduledTime\":\"2999-01-01T00:00:00Z\"}");
        String taskId = json(created).get("taskId").asText();

        HttpResponse<String> listed = get("/api/v1/tasks?limit=50");
        assertEquals(200, listed.statusCode());
        JsonNode tasks = json(listed);
        assertTrue(tasks.isArray());
        boolean found = false;
        for (JsonNode task : tasks) {
            found |= taskId.equals(task.get("id").asText());
        }
        assertTrue(found);

        assertEquals(1, json(get("/api/v1/tasks?limit=1")).size());
        assertEquals(400, get("/api/v1/tasks?limit=0").statusCode());
    }
}

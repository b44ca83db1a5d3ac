package taskwarden.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import taskwarden.App;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.model.TaskPriority;
import taskwarden.coordinator.monitor.StubSystemProbe;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusCommandTest {

    private static final String DB_URL =
            "jdbc:h2:mem:test-cli-status;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

    @BeforeEach
    void captureOut() {
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    @Test
    @DisplayName("Unknown task ids exit with code 2")
    void unknownTask() {
        int exitCode = new CommandLine(new App()).execute("--db-url", DB_URL, "status", "nope");

        assertEquals(StatusCommand.EXIT_UNKNOWN_TASK, exitCode);
    }

    @Test
    @DisplayName("Known tasks print their record")
    void knownTask() {
        String taskId;
        try (Dependencies deps = Dependencies.create(
                CoordinatorConfig.defaults().withDatabaseUrl(DB_URL), StubSystemProbe.idle(2), 0)) {
            taskId = deps.manager()
                    .submitTask("Report", "analytics_update", List.of(), Map.of(), TaskPriority.LOW)
                    .orElseThrow();
        }

        int exitCode = new CommandLine(new App()).execute("--db-url", DB_URL, "status", taskId);

        assertEquals(0, exitCode);
        String output = captured.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Task:        " + taskId));
        assertTrue(output.contains("Status:      QUEUED"));
        assertTrue(output.contains("Priority:    LOW"));
        assertTrue(output.contains("Retries:     0/3"));
    }

    @Test
    @DisplayName("status requires a task id")
    void missingArgument() {
        int exitCode = new CommandLine(new App()).execute("--db-url", DB_URL, "status");

        assertEquals(2, exitCode);
    }
}

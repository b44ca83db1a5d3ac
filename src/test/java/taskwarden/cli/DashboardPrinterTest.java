package taskwarden.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskwarden.coordinator.model.DashboardStats;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DashboardPrinterTest {

    private static DashboardStats stats(boolean throttling) {
        return new DashboardStats(
                new DashboardStats.SystemStats(12.5, 42.3, 61.5, 7.8, 1.25, 120.4),
                new DashboardStats.WorkerStats(3, 1, 4),
                new DashboardStats.TaskStats(5, 20, 15, 2, 4, 3.5, 1.75, Map.of("completed", 15)),
                new DashboardStats.PerformanceStats(75.0, throttling, 9, 3, true));
    }

    @Test
    @DisplayName("render lays out every section")
    void render() {
        String text = DashboardPrinter.render(stats(false));

        assertTrue(text.contains("TASKWARDEN DASHBOARD"));
        assertTrue(text.contains("SYSTEM:"));
        assertTrue(text.contains("   CPU: 42.3% | Memory: 61.5%"));
        assertTrue(text.contains("   Active: 3 | Dead: 1 | Total: 4"));
        assertTrue(text.contains("   Queue Size: 5"));
        assertTrue(text.contains("   Queued: 20 | Completed: 15 | Failed: 2 | Retried: 4"));
        assertTrue(text.contains("   Recent (1h): {completed=15}"));
        assertTrue(text.contains("   Success Rate: 75.00%"));
        assertTrue(text.contains("   Throttling: NO (9 events)"));
        assertTrue(text.contains("   Queue: shared (database)"));
    }

    @Test
    @DisplayName("Throttling shows as YES")
    void throttling() {
        assertTrue(DashboardPrinter.render(stats(true)).contains("   Throttling: YES (9 events)"));
    }

    @Test
    @DisplayName("print writes the rendered dashboard to the stream")
    void print() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        DashboardPrinter.print(stats(false), out);

        assertEquals(DashboardPrinter.render(stats(false)), buffer.toString(StandardCharsets.UTF_8));
    }
}

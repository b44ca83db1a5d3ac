package taskwarden.cli;

import taskwarden.coordinator.model.DashboardStats;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Text rendering of {@link DashboardStats} for the terminal.
 */
public final class DashboardPrinter {

    private static final String RULE = "=".repeat(80);

    private DashboardPrinter() {
    }

    public static void print(DashboardStats stats, PrintStream out) {
        out.print(render(stats));
        out.flush();
    }

    public static String render(DashboardStats stats) {
        StringBuilder sb = new StringBuilder();
        line(sb, "");
        line(sb, RULE);
        line(sb, "TASKWARDEN DASHBOARD");
        line(sb, RULE);

        DashboardStats.SystemStats system = stats.system();
        line(sb, "SYSTEM:");
        line(sb, "   Uptime: %.1f minutes", system.uptimeMinutes());
        line(sb, "   CPU: %.1f%% | Memory: %.1f%%", system.cpuPercent(), system.memoryPercent());
        line(sb, "   Memory Available: %.1f GB", system.memoryAvailableGb());
        line(sb, "   Load Average: %.2f", system.loadAverage());
        line(sb, "   Disk Free: %.1f GB", system.diskFreeGb());

        DashboardStats.WorkerStats workers = stats.workers();
        line(sb, "");
        line(sb, "WORKERS:");
        line(sb, "   Active: %d | Dead: %d | Total: %d", workers.active(), workers.dead(), workers.total());

        DashboardStats.TaskStats tasks = stats.tasks();
        line(sb, "");
        line(sb, "TASKS:");
        line(sb, "   Queue Size: %d", tasks.queueSize());
        line(sb, "   Queued: %d | Completed: %d | Failed: %d | Retried: %d",
                tasks.totalQueued(), tasks.totalCompleted(), tasks.totalFailed(), tasks.totalRetried());
        line(sb, "   Rate: %.2f tasks/min", tasks.tasksPerMinute());
        line(sb, "   Avg Execution: %.2fs", tasks.avgExecutionTime());
        if (tasks.recentByStatus() != null && !tasks.recentByStatus().isEmpty()) {
            line(sb, "   Recent (1h): %s", tasks.recentByStatus());
        }

        DashboardStats.PerformanceStats perf = stats.performance();
        line(sb, "");
        line(sb, "PERFORMANCE:");
        line(sb, "   Success Rate: %.2f%%", perf.successRate());
        line(sb, "   Throttling: %s (%d events)", perf.throttling() ? "YES" : "NO", perf.throttleEvents());
        line(sb, "   Recommended Workers: %d", perf.recommendedWorkers());
        line(sb, "   Queue: %s", perf.queueShared() ? "shared (database)" : "in-memory (this process only)");

        line(sb, RULE);
        return sb.toString();
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(args.length == 0 ? format : String.format(Locale.ROOT, format, args)).append(System.lineSeparator());
    }
}

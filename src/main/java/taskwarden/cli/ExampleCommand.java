package taskwarden.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import taskwarden.App;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.core.DistributedTaskManager;
import taskwarden.coordinator.model.SubmitOptions;
import taskwarden.coordinator.model.TaskPriority;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Submits a mix of demo tasks across every priority level and prints the
 * dashboard while the workers drain them.
 */
@Command(name = "example", description = "Run the demonstration workload")
public class ExampleCommand implements Callable<Integer> {

    @ParentCommand
    private App app;

    @Option(names = {"--cycles"}, description = "Dashboard cycles before exiting (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int cycles;

    @Option(names = {"--interval"}, description = "Seconds between cycles (default: ${DEFAULT-VALUE})",
            defaultValue = "30")
    private int interval;

    @Option(names = {"-w", "--workers"}, description = "Worker count (default: ${DEFAULT-VALUE})",
            defaultValue = "2")
    private int workers;

    @Override
    public Integer call() throws Exception {
        if (cycles < 0 || interval <= 0) {
            System.err.println("ERROR: --cycles must be >= 0 and --interval positive");
            return 1;
        }

        try (Dependencies deps = app.dependencies()) {
            DistributedTaskManager manager = deps.manager();
            manager.start(workers);
            System.out.println("Task manager started with " + manager.workerPool().liveCount() + " workers");

            submitInitialMix(manager);

            for (int i = 0; i < cycles; i++) {
                TimeUnit.SECONDS.sleep(interval);
                DashboardPrinter.print(manager.getDashboardStats(), System.out);

                if (i % 3 == 0) {
                    manager.submitTask("Periodic Market Update", "market_data_fetch", List.of(),
                            Map.of("symbol", "SENSEX"), TaskPriority.HIGH);
                }
            }
        }
        return 0;
    }

    static void submitInitialMix(DistributedTaskManager manager) {
        manager.submitTask("System Health Check", "system_health_check", List.of(), Map.of(),
                TaskPriority.CRITICAL);
        manager.submitTask("Fetch NIFTY Data", "market_data_fetch", List.of(), Map.of("symbol", "NIFTY"),
                TaskPriority.HIGH);
        for (String topic : List.of("market_analysis", "stock_tips", "portfolio_advice")) {
            manager.submitTask("Generate " + topic + " content", "content_generation", List.of(),
                    Map.of("topic", topic), TaskPriority.MEDIUM);
        }
        for (String channel : List.of("@taskwarden_news", "@taskwarden_markets")) {
            manager.submitTask("Post to " + channel, "telegram_post", List.of(), Map.of("channel", channel),
                    TaskPriority.LOW, SubmitOptions.defaults().withMaxRetries(2));
        }
        manager.submitTask("Update Analytics", "analytics_update", List.of(), Map.of(), TaskPriority.BATCH);
        manager.submitTask("Database Cleanup", "database_cleanup", List.of(), Map.of(), TaskPriority.BATCH);
    }
}

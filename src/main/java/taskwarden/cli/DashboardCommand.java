package taskwarden.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import taskwarden.App;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.server.RouterHandler;

import java.util.concurrent.Callable;

/**
 * One-shot dashboard snapshot. No workers are started. Task totals and success rate come
 * from the store; retry and throttle counts only cover this process, so they read 0 here.
 */
@Command(name = "dashboard", description = "Print a dashboard snapshot and exit")
public class DashboardCommand implements Callable<Integer> {

    @ParentCommand
    private App app;

    @Option(names = {"--json"}, description = "Print the stats as JSON")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try (Dependencies deps = app.dependencies()) {
            var stats = deps.manager().getDashboardStats();
            if (json) {
                System.out.println(RouterHandler.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(stats));
            } else {
                DashboardPrinter.print(stats, System.out);
            }
        }
        return 0;
    }
}

package taskwarden.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import taskwarden.App;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.core.DistributedTaskManager;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the task manager until the process is told to shut down.
 */
@Command(name = "start", description = "Start workers and background loops, print the dashboard periodically")
public class StartCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StartCommand.class);

    @ParentCommand
    private App app;

    @Option(names = {"-w", "--workers"},
            description = "Initial worker count (default: recommended for this host)")
    private Integer workers;

    @Option(names = {"--http-port"},
            description = "Serve the HTTP API on this port (default: TASKWARDEN_HTTP_PORT, disabled if unset)")
    private Integer httpPort;

    @Option(names = {"--dashboard-interval"},
            description = "Seconds between dashboard prints (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    private int dashboardInterval;

    @Override
    public Integer call() throws Exception {
        if (dashboardInterval <= 0) {
            System.err.println("ERROR: --dashboard-interval must be positive");
            return 1;
        }

        Dependencies deps = app.dependencies();
        DistributedTaskManager manager = deps.manager();
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            shutdown.countDown();
            deps.close();
        }, "taskwarden-shutdown"));

        if (workers != null) {
            manager.start(workers);
        } else {
            manager.start();
        }

        int port = httpPort != null ? httpPort : deps.config().serverPort();
        if (port > 0) {
            int bound = deps.startServer(port);
            System.out.println("HTTP API on port " + bound);
        }

        while (!shutdown.await(dashboardInterval, TimeUnit.SECONDS)) {
            DashboardPrinter.print(manager.getDashboardStats(), System.out);
        }
        return 0;
    }
}

package taskwarden;

import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import taskwarden.cli.DashboardCommand;
import taskwarden.cli.ExampleCommand;
import taskwarden.cli.StartCommand;
import taskwarden.cli.StatusCommand;
import taskwarden.coordinator.config.CoordinatorConfig;
import taskwarden.coordinator.config.Dependencies;

import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * Global options apply to every subcommand; subcommands read them through
 * {@link #dependencies()}.
 */
@Command(
        name = "taskwarden",
        description = "Resource-aware task manager",
        version = "taskwarden 1.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                StartCommand.class,
                DashboardCommand.class,
                ExampleCommand.class,
                StatusCommand.class
        })
public class App implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG logging)")
    private boolean verbose;

    @Option(names = {"--db-url"}, description = "JDBC URL of the task store (default: TASKWARDEN_DB_URL or ./data)")
    private String databaseUrl;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // no subcommand
        new CommandLine(this).usage(System.out);
        return 0;
    }

    public CoordinatorConfig config() {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        if (databaseUrl != null && !databaseUrl.isBlank()) {
            config.withDatabaseUrl(databaseUrl);
        }
        return config;
    }

    /**
     * Wire the application for a subcommand. The caller closes it.
     */
    public Dependencies dependencies() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME))
                    .setLevel(Level.DEBUG);
        }
        return Dependencies.create(config());
    }
}

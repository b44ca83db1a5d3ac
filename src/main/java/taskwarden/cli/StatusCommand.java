package taskwarden.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import taskwarden.App;
import taskwarden.coordinator.config.Dependencies;
import taskwarden.coordinator.model.Task;
import taskwarden.coordinator.model.TaskStatus;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prints the durable record of one task.
 */
@Command(name = "status", description = "Show the status of a task")
public class StatusCommand implements Callable<Integer> {

    static final int EXIT_UNKNOWN_TASK = 2;

    @ParentCommand
    private App app;

    @Parameters(index = "0", description = "Task id")
    private String taskId;

    @Override
    public Integer call() throws Exception {
        try (Dependencies deps = app.dependencies()) {
            Optional<Task> found = deps.manager().getTaskStatus(taskId);
            if (found.isEmpty()) {
                System.err.println("Unknown task: " + taskId);
                return EXIT_UNKNOWN_TASK;
            }

            Task task = found.get();
            System.out.println("Task:        " + task.id());
            System.out.println("Name:        " + task.name());
            System.out.println("Function:    " + task.function());
            System.out.println("Priority:    " + task.priority());
            System.out.println("Status:      " + task.status());
            System.out.println("Created:     " + task.createdAt());
            if (task.completedAt() != null) {
                System.out.println("Completed:   " + task.completedAt());
            }
            if (task.workerId() != null) {
                System.out.println("Worker:      " + task.workerId());
            }
            if (task.executionTimeSeconds() != null) {
                System.out.printf("Execution:   %.3fs%n", task.executionTimeSeconds());
            }
            System.out.println("Retries:     " + task.retryCount() + "/" + task.maxRetries());
            if (task.error() != null) {
                System.out.println("Error:       " + task.error());
            }
            if (task.status() == TaskStatus.COMPLETED) {
                deps.manager().getTaskResult(taskId)
                        .ifPresent(result -> System.out.println("Result:      " + result));
            }
        }
        return 0;
    }
}

package taskwarden.coordinator.worker;

import java.util.List;
import java.util.Map;

/**
 * Executes tasks registered under one function name.
 *
 * Implementations may block; they run on a worker's executor thread and are
 * interrupted when the task's timeout expires. The returned value is stored as
 * JSON, so it should be a string, number, boolean, list, map or null.
 */
@FunctionalInterface
public interface TaskHandler {

    Object execute(List<Object> args, Map<String, Object> kwargs) throws Exception;
}

package taskwarden.coordinator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps function names to handlers. Register everything before workers start.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the name is blank or already taken
     */
    public HandlerRegistry register(String function, TaskHandler handler) {
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("function name is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        if (handlers.putIfAbsent(function, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for function: " + function);
        }
        log.debug("Registered handler for {}", function);
        return this;
    }

    public TaskHandler resolve(String function) throws UnknownHandlerException {
        TaskHandler handler = function != null ? handlers.get(function) : null;
        if (handler == null) {
            throw new UnknownHandlerException(function);
        }
        return handler;
    }

    public boolean contains(String function) {
        return function != null && handlers.containsKey(function);
    }

    public Set<String> functions() {
        return new TreeSet<>(handlers.keySet());
    }
}

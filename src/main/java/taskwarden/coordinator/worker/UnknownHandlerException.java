package taskwarden.coordinator.worker;

/**
 * No handler is registered under the requested function name.
 * Tasks failing this way are never retried.
 */
public class UnknownHandlerException extends Exception {

    private final String function;

    public UnknownHandlerException(String function) {
        super("Unknown function: " + function);
        this.function = function;
    }

    public String function() {
        return function;
    }
}

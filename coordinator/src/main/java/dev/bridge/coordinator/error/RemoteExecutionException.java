package dev.bridge.coordinator.error;

/**
 * The executor answered with {@code ok=false}. The message is the executor's text, verbatim.
 */
public class RemoteExecutionException extends BridgeException {

    private static final long serialVersionUID = 1L;

    private final String kind;

    public RemoteExecutionException(String kind, String message) {
        super(message == null ? "Executor reported a failure without a message" : message);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}

package dev.bridge.coordinator.error;

/**
 * Malformed call parameters. Raised before anything is sent to the executor.
 */
public class ValidationException extends BridgeException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

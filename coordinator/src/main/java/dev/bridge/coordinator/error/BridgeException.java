package dev.bridge.coordinator.error;

/**
 * Base type of every failure the bridge reports to its callers.
 */
public class BridgeException extends Exception {

    private static final long serialVersionUID = 1L;

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dev.bridge.coordinator.error;

/**
 * The executor connection went away while the call was pending, or the request could not be
 * written to it.
 */
public class ConnectionLostException extends BridgeException {

    private static final long serialVersionUID = 1L;

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}

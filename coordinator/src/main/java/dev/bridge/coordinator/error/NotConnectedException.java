package dev.bridge.coordinator.error;

/**
 * No executor is connected. Calls are never queued while disconnected.
 */
public class NotConnectedException extends BridgeException {

    private static final long serialVersionUID = 1L;

    public NotConnectedException(String message) {
        super(message);
    }
}

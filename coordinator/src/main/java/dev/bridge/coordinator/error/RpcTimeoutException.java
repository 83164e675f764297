package dev.bridge.coordinator.error;

import java.time.Duration;

/**
 * No reply arrived before the call's deadline.
 */
public class RpcTimeoutException extends BridgeException {

    private static final long serialVersionUID = 1L;

    public RpcTimeoutException(String kind, String id, Duration timeout) {
        super("Request " + id + " (" + kind + ") timed out after " + timeout.toMillis() + " ms");
    }
}

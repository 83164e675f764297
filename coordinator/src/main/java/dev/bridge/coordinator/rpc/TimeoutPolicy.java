package dev.bridge.coordinator.rpc;

import dev.bridge.coordinator.config.BridgeProperties;
import java.time.Duration;
import java.util.Objects;

/**
 * Resolves the deadline of a call from the caller's value, the per-kind table or the default.
 */
public class TimeoutPolicy {

    private final BridgeProperties properties;

    public TimeoutPolicy(BridgeProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public Duration timeoutFor(String kind) {
        Duration configured = properties.getOperationTimeouts().get(kind);
        return configured != null ? configured : properties.getDefaultTimeout();
    }

    public Duration resolve(String kind, Duration requested) {
        return requested != null ? requested : timeoutFor(kind);
    }
}

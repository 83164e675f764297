package dev.bridge.coordinator.bulk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.bridge.coordinator.error.BridgeException;

/**
 * Result of one attempted item of a fan-out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchOutcome(int index, boolean success, Object value, String error,
                              @JsonIgnore BridgeException failure) {

    public static DispatchOutcome success(int index, Object value) {
        return new DispatchOutcome(index, true, value, null, null);
    }

    public static DispatchOutcome failure(int index, BridgeException failure) {
        return new DispatchOutcome(index, false, null, failure.getMessage(), failure);
    }
}

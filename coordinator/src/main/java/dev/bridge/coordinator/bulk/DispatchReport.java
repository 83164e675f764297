package dev.bridge.coordinator.bulk;

import java.util.List;

/**
 * Outcomes of a fan-out in item order. Only attempted items are present; {@code failedFast} marks
 * a loop stopped by the first failure.
 */
public record DispatchReport(List<DispatchOutcome> outcomes, boolean failedFast) {

    public DispatchReport {
        outcomes = List.copyOf(outcomes);
    }
}

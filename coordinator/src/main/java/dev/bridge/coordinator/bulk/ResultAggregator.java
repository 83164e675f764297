package dev.bridge.coordinator.bulk;

import dev.bridge.coordinator.error.BridgeException;

/**
 * Shapes a {@link DispatchReport} for the caller: a single-item call yields its bare value or
 * throws its error, a fan-out yields a {@link BulkSummary}.
 */
public class ResultAggregator {

    public Object aggregate(DispatchReport report, int requestedItems) throws BridgeException {
        if (requestedItems == 1) {
            DispatchOutcome outcome = report.outcomes().get(0);
            if (outcome.success()) {
                return outcome.value();
            }
            throw outcome.failure();
        }
        int successCount = 0;
        for (DispatchOutcome outcome : report.outcomes()) {
            if (outcome.success()) {
                successCount++;
            }
        }
        return new BulkSummary(requestedItems, successCount, report.outcomes().size() - successCount,
            report.outcomes(), report.failedFast());
    }
}

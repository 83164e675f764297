package dev.bridge.coordinator.bulk;

import java.util.List;

public record BulkSummary(int totalItems, int successCount, int errorCount, List<DispatchOutcome> results,
                          boolean failedFast) {
}

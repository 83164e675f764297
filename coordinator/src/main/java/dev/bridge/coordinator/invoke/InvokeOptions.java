package dev.bridge.coordinator.invoke;

import java.time.Duration;
import java.util.Set;

/**
 * Per-call options of {@link BridgeInvoker#invoke}.
 *
 * @param failFast stop at the first failed item instead of attempting every item
 * @param timeout  deadline of each item; {@code null} uses the configured timeout of the kind
 * @param bulkKeys parameters that may carry one value per item
 * @param count    explicit number of items; {@code null} derives it from the bulk arrays
 */
public record InvokeOptions(boolean failFast, Duration timeout, Set<String> bulkKeys, Integer count) {

    public InvokeOptions {
        bulkKeys = bulkKeys == null ? Set.of() : Set.copyOf(bulkKeys);
    }

    public static InvokeOptions defaults() {
        return new InvokeOptions(false, null, Set.of(), null);
    }

    public InvokeOptions withFailFast(boolean failFast) {
        return new InvokeOptions(failFast, timeout, bulkKeys, count);
    }

    public InvokeOptions withTimeout(Duration timeout) {
        return new InvokeOptions(failFast, timeout, bulkKeys, count);
    }

    public InvokeOptions withBulkKeys(String... keys) {
        return new InvokeOptions(failFast, timeout, Set.of(keys), count);
    }

    public InvokeOptions withCount(Integer count) {
        return new InvokeOptions(failFast, timeout, bulkKeys, count);
    }
}

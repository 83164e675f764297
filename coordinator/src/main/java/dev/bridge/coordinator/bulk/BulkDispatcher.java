package dev.bridge.coordinator.bulk;

import dev.bridge.coordinator.error.BridgeException;
import dev.bridge.coordinator.rpc.RpcClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the items of a fan-out one after another; item {@code i + 1} is sent only once item
 * {@code i} has resolved.
 */
public class BulkDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(BulkDispatcher.class);

    private final RpcClient rpcClient;

    public BulkDispatcher(RpcClient rpcClient) {
        this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient");
    }

    public DispatchReport dispatch(String kind, List<Map<String, Object>> items, boolean failFast, Duration timeout)
        throws InterruptedException {
        List<DispatchOutcome> outcomes = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                Object value = rpcClient.call(kind, items.get(i), timeout).get();
                outcomes.add(DispatchOutcome.success(i, value));
            } catch (ExecutionException e) {
                BridgeException failure = unwrap(e);
                outcomes.add(DispatchOutcome.failure(i, failure));
                if (failFast) {
                    LOGGER.info("{} item {} of {} failed, stopping: {}", kind, i, items.size(), failure.getMessage());
                    return new DispatchReport(outcomes, true);
                }
                LOGGER.debug("{} item {} of {} failed: {}", kind, i, items.size(), failure.getMessage());
            }
        }
        return new DispatchReport(outcomes, false);
    }

    private static BridgeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof BridgeException bridgeException) {
            return bridgeException;
        }
        return new BridgeException(String.valueOf(cause == null ? e.getMessage() : cause.getMessage()), cause);
    }
}

package dev.bridge.coordinator.invoke;

import dev.bridge.coordinator.bulk.BulkDispatcher;
import dev.bridge.coordinator.bulk.DispatchReport;
import dev.bridge.coordinator.bulk.ParameterDecoder;
import dev.bridge.coordinator.bulk.ParameterNormalizer;
import dev.bridge.coordinator.bulk.ResultAggregator;
import dev.bridge.coordinator.error.BridgeException;
import dev.bridge.coordinator.error.ValidationException;
import dev.bridge.coordinator.rpc.TimeoutPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: validates and expands the parameters of one call, sends the
 * resulting items to the executor and returns either the bare result of a single item or a
 * {@link dev.bridge.coordinator.bulk.BulkSummary}.
 */
public class BridgeInvoker {

    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeInvoker.class);

    private final ParameterDecoder decoder;
    private final ParameterNormalizer normalizer;
    private final BulkDispatcher dispatcher;
    private final ResultAggregator aggregator;
    private final TimeoutPolicy timeoutPolicy;

    public BridgeInvoker(ParameterDecoder decoder, ParameterNormalizer normalizer, BulkDispatcher dispatcher,
                         ResultAggregator aggregator, TimeoutPolicy timeoutPolicy) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.timeoutPolicy = Objects.requireNonNull(timeoutPolicy, "timeoutPolicy");
    }

    public Object invoke(String kind, Map<String, Object> params, InvokeOptions options)
        throws BridgeException, InterruptedException {
        Objects.requireNonNull(kind, "kind");
        InvokeOptions effective = options == null ? InvokeOptions.defaults() : options;
        if (effective.timeout() != null && (effective.timeout().isZero() || effective.timeout().isNegative())) {
            throw new ValidationException("timeout must be positive but was " + effective.timeout());
        }
        ParameterDecoder.DecodedParameters decoded =
            decoder.decode(kind, params == null ? Map.of() : params, effective.bulkKeys());
        List<Map<String, Object>> items = normalizer.normalize(decoded.values(), decoded.bulkKeys(), effective.count());
        Duration timeout = timeoutPolicy.resolve(kind, effective.timeout());
        if (items.size() > 1) {
            LOGGER.info("Dispatching {} x{} (failFast={}, timeout={} ms)", kind, items.size(), effective.failFast(),
                timeout.toMillis());
        }
        DispatchReport report = dispatcher.dispatch(kind, items, effective.failFast(), timeout);
        return aggregator.aggregate(report, items.size());
    }

    public Object invoke(String kind, Map<String, Object> params) throws BridgeException, InterruptedException {
        return invoke(kind, params, InvokeOptions.defaults());
    }
}

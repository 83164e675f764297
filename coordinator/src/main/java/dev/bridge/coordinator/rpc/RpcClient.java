package dev.bridge.coordinator.rpc;

import dev.bridge.coordinator.error.BridgeException;
import dev.bridge.coordinator.error.ConnectionLostException;
import dev.bridge.coordinator.error.NotConnectedException;
import dev.bridge.coordinator.error.RemoteExecutionException;
import dev.bridge.coordinator.error.RpcTimeoutException;
import dev.bridge.coordinator.error.ValidationException;
import dev.bridge.coordinator.health.HealthMetrics;
import dev.bridge.coordinator.transport.ChannelListener;
import dev.bridge.coordinator.transport.TransportChannel;
import dev.bridge.transport.Envelope;
import dev.bridge.transport.LengthPrefixedCodec;
import dev.bridge.transport.ReplyEnvelope;
import dev.bridge.transport.RequestEnvelope;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends requests over the {@link TransportChannel} and resolves each returned future from the
 * reply carrying the same id, the call's deadline, or the loss of the connection, whichever
 * comes first. Calls are never queued while disconnected and never retried.
 */
public class RpcClient implements ChannelListener, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcClient.class);

    private final TransportChannel channel;
    private final HealthMetrics metrics;
    private final Supplier<String> idGenerator;
    private final Clock clock;
    private final CorrelationTable table = new CorrelationTable();
    private final ScheduledExecutorService deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "rpc-deadlines");
        t.setDaemon(true);
        return t;
    });

    public RpcClient(TransportChannel channel, HealthMetrics metrics) {
        this(channel, metrics, () -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    public RpcClient(TransportChannel channel, HealthMetrics metrics, Supplier<String> idGenerator, Clock clock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.clock = Objects.requireNonNull(clock, "clock");
        channel.addListener(this);
    }

    public CompletableFuture<Object> call(String kind, Map<String, Object> payload, Duration timeout) {
        Objects.requireNonNull(kind, "kind");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (!channel.isConnected()) {
            return CompletableFuture.failedFuture(
                new NotConnectedException("No executor connected; cannot send " + kind));
        }

        Instant now = clock.instant();
        PendingCall call = PendingCall.create(idGenerator.get(), kind, now, now.plus(timeout));
        table.register(call);
        ScheduledFuture<?> timer = deadlines.schedule(() -> expire(call, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
        call.future().whenComplete((result, error) -> timer.cancel(false));

        try {
            channel.send(Envelope.request(new RequestEnvelope(call.id(), kind, payload)));
        } catch (LengthPrefixedCodec.FrameTooLargeException e) {
            if (table.remove(call)) {
                fail(call, new ValidationException("Request " + kind + " exceeds the frame size limit", e));
            }
        } catch (IOException e) {
            if (table.remove(call)) {
                fail(call, new ConnectionLostException(
                    "Failed to send request " + call.id() + " (" + kind + "): " + e.getMessage(), e));
            }
        }
        return call.future();
    }

    private void expire(PendingCall call, Duration timeout) {
        if (table.remove(call)) {
            LOGGER.warn("Request {} ({}) timed out after {} ms", call.id(), call.kind(), timeout.toMillis());
            fail(call, new RpcTimeoutException(call.kind(), call.id(), timeout));
        }
    }

    @Override
    public void onMessage(Envelope envelope) {
        ReplyEnvelope reply = envelope.reply();
        if (reply == null) {
            return;
        }
        PendingCall call = table.take(reply.id());
        if (call == null) {
            LOGGER.debug("Discarding reply for retired request {}", reply.id());
            return;
        }
        if (reply.ok()) {
            metrics.recordSuccess(elapsed(call));
            call.future().complete(reply.result());
        } else {
            fail(call, new RemoteExecutionException(call.kind(), reply.error()));
        }
    }

    @Override
    public void onDisconnect(String connectionId, String reason) {
        List<PendingCall> drained = table.drain();
        if (!drained.isEmpty()) {
            LOGGER.warn("Failing {} pending request(s) after losing {}: {}", drained.size(), connectionId, reason);
        }
        for (PendingCall call : drained) {
            fail(call, new ConnectionLostException("Executor connection lost: " + reason));
        }
    }

    private void fail(PendingCall call, BridgeException error) {
        metrics.recordFailure(elapsed(call), error.getMessage());
        call.future().completeExceptionally(error);
    }

    private Duration elapsed(PendingCall call) {
        return Duration.between(call.createdAt(), clock.instant());
    }

    public int pendingCount() {
        return table.size();
    }

    public List<PendingCall> pendingCalls() {
        return table.snapshot();
    }

    @Override
    public void close() {
        channel.removeListener(this);
        for (PendingCall call : table.drain()) {
            fail(call, new ConnectionLostException("RPC client closed"));
        }
        deadlines.shutdownNow();
    }
}

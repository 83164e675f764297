package dev.bridge.coordinator.health;

import dev.bridge.coordinator.error.NotConnectedException;
import dev.bridge.coordinator.rpc.RpcClient;
import dev.bridge.coordinator.transport.ChannelListener;
import dev.bridge.coordinator.transport.TransportChannel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows the executor connection and reports its health.
 */
public class BridgeMonitor implements ChannelListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeMonitor.class);

    static final Duration DEGRADED_RESPONSE_TIME = Duration.ofSeconds(10);

    private final RpcClient rpcClient;
    private final HealthMetrics metrics;
    private final Clock clock;

    private boolean connected;
    private String connectionId;
    private Instant connectedSince;
    private long connectionCount;

    public BridgeMonitor(TransportChannel channel, RpcClient rpcClient, HealthMetrics metrics) {
        this(channel, rpcClient, metrics, Clock.systemUTC());
    }

    public BridgeMonitor(TransportChannel channel, RpcClient rpcClient, HealthMetrics metrics, Clock clock) {
        this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        channel.addListener(this);
    }

    @Override
    public synchronized void onConnect(String connectionId) {
        connectionCount++;
        this.connected = true;
        this.connectionId = connectionId;
        this.connectedSince = clock.instant();
        if (connectionCount > 1) {
            LOGGER.info("Executor reconnected from {} (reconnect #{})", connectionId, connectionCount - 1);
        } else {
            LOGGER.info("Executor connected from {}", connectionId);
        }
        notifyAll();
    }

    @Override
    public synchronized void onDisconnect(String connectionId, String reason) {
        if (!connectionId.equals(this.connectionId)) {
            return;
        }
        this.connected = false;
        this.connectionId = null;
        this.connectedSince = null;
        LOGGER.warn("Executor {} disconnected: {}", connectionId, reason);
    }

    /**
     * Blocks until an executor is connected.
     *
     * @throws NotConnectedException if none connected within {@code timeout}
     */
    public synchronized void waitForExecutor(Duration timeout) throws NotConnectedException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!connected) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new NotConnectedException("No executor connected within " + timeout.toMillis() + " ms");
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    public ConnectionStatus status() {
        boolean isConnected;
        String currentId;
        Instant since;
        long reconnects;
        synchronized (this) {
            isConnected = connected;
            currentId = connectionId;
            since = connectedSince;
            reconnects = Math.max(0, connectionCount - 1);
        }
        Duration average = metrics.averageResponseTime();
        ConnectionHealth health;
        if (!isConnected) {
            health = ConnectionHealth.UNHEALTHY;
        } else if (average.compareTo(DEGRADED_RESPONSE_TIME) > 0) {
            health = ConnectionHealth.DEGRADED;
        } else {
            health = ConnectionHealth.HEALTHY;
        }
        return new ConnectionStatus(isConnected, currentId, since, reconnects, rpcClient.pendingCount(),
            metrics.getSuccessCount(), metrics.getErrorCount(), metrics.getLastError(), average, health);
    }
}

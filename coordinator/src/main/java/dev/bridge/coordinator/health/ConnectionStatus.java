package dev.bridge.coordinator.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the executor connection and the calls made over it.
 */
public record ConnectionStatus(
    boolean connected,
    String connectionId,
    Instant connectedSince,
    long reconnectCount,
    int pendingCalls,
    long successCount,
    long errorCount,
    String lastError,
    Duration averageResponseTime,
    ConnectionHealth health
) {
}

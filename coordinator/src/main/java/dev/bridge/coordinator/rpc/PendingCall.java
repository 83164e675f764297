package dev.bridge.coordinator.rpc;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A request that has been sent and not yet resolved by a reply, its deadline or a disconnect.
 */
public record PendingCall(String id, String kind, Instant createdAt, Instant deadline, CompletableFuture<Object> future) {

    static PendingCall create(String id, String kind, Instant createdAt, Instant deadline) {
        return new PendingCall(id, kind, createdAt, deadline, new CompletableFuture<>());
    }
}

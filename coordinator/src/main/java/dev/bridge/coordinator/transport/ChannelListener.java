package dev.bridge.coordinator.transport;

import dev.bridge.transport.Envelope;

/**
 * Callbacks from a {@link TransportChannel}. They run on the channel's reader thread and must
 * not block.
 */
public interface ChannelListener {

    default void onConnect(String connectionId) {
    }

    /**
     * A reply frame from the current executor.
     */
    default void onMessage(Envelope envelope) {
    }

    /**
     * Fired exactly once per lost connection.
     */
    default void onDisconnect(String connectionId, String reason) {
    }
}

package dev.bridge.coordinator.transport;

import dev.bridge.transport.Envelope;
import java.io.IOException;

/**
 * Duplex, ordered, framed pipe to the one current executor. Implementations report lifecycle
 * and inbound replies through {@link ChannelListener}s.
 */
public interface TransportChannel {

    /**
     * Writes one frame to the current executor.
     *
     * @throws IOException when no executor is connected or the write fails
     */
    void send(Envelope envelope) throws IOException;

    boolean isConnected();

    void addListener(ChannelListener listener);

    void removeListener(ChannelListener listener);
}

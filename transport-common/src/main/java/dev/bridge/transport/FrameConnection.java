package dev.bridge.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;

/**
 * A socket carrying length-prefixed {@link Envelope} frames. Reads are expected from a single
 * reader thread; writes may come from any thread and are serialized.
 */
public final class FrameConnection implements Closeable {

    private final Socket socket;
    private final String connectionId;
    private final EnvelopeCodec codec;
    private final int maxFrameBytes;
    private final InputStream in;
    private final OutputStream out;
    private final Object writeLock = new Object();

    public FrameConnection(Socket socket, EnvelopeCodec codec, int maxFrameBytes) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.maxFrameBytes = maxFrameBytes;
        this.connectionId = String.valueOf(socket.getRemoteSocketAddress());
        socket.setTcpNoDelay(true);
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    /**
     * Blocks for the next envelope.
     *
     * @return the envelope, or {@code null} once the peer closed the stream
     */
    public Envelope read() throws IOException {
        String frame = LengthPrefixedCodec.readFrame(in, maxFrameBytes);
        if (frame == null) {
            return null;
        }
        Envelope envelope = codec.decode(frame);
        Wire.rx(connectionId, envelope, frame);
        return envelope;
    }

    public void write(Envelope envelope) throws IOException {
        String frame = codec.encode(envelope);
        synchronized (writeLock) {
            Wire.tx(connectionId, envelope, frame);
            LengthPrefixedCodec.writeFrame(out, frame, maxFrameBytes);
        }
    }

    public String connectionId() {
        return connectionId;
    }

    @Override
    public void close() throws IOException {
        if (!socket.isClosed()) {
            socket.close();
        }
    }
}

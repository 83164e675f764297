package dev.bridge.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Codec that writes and reads frames that start with a four-byte big-endian length followed by
 * UTF-8 encoded JSON text. Both directions enforce a maximum payload size.
 */
public final class LengthPrefixedCodec {

    public static final int DEFAULT_MAX_FRAME_BYTES = 1024 * 1024;

    private static final int HEADER_BYTES = 4;

    private LengthPrefixedCodec() {
    }

    public static void writeFrame(OutputStream out, String json, int maxFrameBytes) throws IOException {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        if (payload.length > maxFrameBytes) {
            throw new FrameTooLargeException(payload.length, maxFrameBytes);
        }
        byte[] header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        byte[] frame = new byte[HEADER_BYTES + payload.length];
        System.arraycopy(header, 0, frame, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, frame, HEADER_BYTES, payload.length);
        out.write(frame);
        out.flush();
    }

    /**
     * Reads one frame.
     *
     * @return the frame text, or {@code null} when the stream ended cleanly before a header
     */
    public static String readFrame(InputStream in, int maxFrameBytes) throws IOException {
        byte[] header = readFully(in, HEADER_BYTES);
        if (header == null) {
            return null; // EOF before header indicates clean shutdown.
        }
        int length = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (length < 0) {
            throw new IOException("Invalid frame length: " + length);
        }
        if (length > maxFrameBytes) {
            throw new FrameTooLargeException(length, maxFrameBytes);
        }
        byte[] payload = readFully(in, length);
        if (payload == null) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                if (offset == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream after reading " + offset + " bytes");
            }
            offset += read;
        }
        return buffer;
    }

    /**
     * Raised when a frame exceeds the configured limit in either direction.
     */
    public static final class FrameTooLargeException extends IOException {

        private static final long serialVersionUID = 1L;

        FrameTooLargeException(int length, int maxFrameBytes) {
            super("Frame too large: " + length + " bytes (limit " + maxFrameBytes + ")");
        }
    }
}

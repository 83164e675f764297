package dev.bridge.transport;

/**
 * Values of {@link Envelope#type()}.
 */
public final class MessageTypes {

    public static final String HELLO = "hello";
    public static final String CONNECTED = "connected";
    public static final String REQUEST = "request";
    public static final String REPLY = "reply";
    public static final String HEARTBEAT = "heartbeat";
    public static final String HEARTBEAT_ACK = "heartbeat_ack";
    public static final String LOG = "log";

    private MessageTypes() {
    }

    static boolean isHeartbeat(String type) {
        return HEARTBEAT.equals(type) || HEARTBEAT_ACK.equals(type);
    }
}

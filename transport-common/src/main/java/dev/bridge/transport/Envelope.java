package dev.bridge.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport wrapper. One envelope is one frame on the wire; {@link #type()} decides which of
 * the optional sections is populated: {@code request} for requests, {@code reply} for replies
 * and {@code body} for control frames (hello, connected, log).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Envelope(
    String type,
    String sessionId,
    RequestEnvelope request,
    ReplyEnvelope reply,
    Map<String, Object> body
) {

    public static Envelope request(RequestEnvelope request) {
        return new Envelope(MessageTypes.REQUEST, null, request, null, null);
    }

    public static Envelope reply(ReplyEnvelope reply) {
        return new Envelope(MessageTypes.REPLY, null, null, reply, null);
    }

    public static Envelope hello(String executorName, String version) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("executor", executorName);
        body.put("version", version);
        return new Envelope(MessageTypes.HELLO, null, null, null, body);
    }

    public static Envelope connected(String sessionId) {
        return new Envelope(MessageTypes.CONNECTED, sessionId, null, null, null);
    }

    public static Envelope heartbeat() {
        return new Envelope(MessageTypes.HEARTBEAT, null, null, null, null);
    }

    public static Envelope heartbeatAck() {
        return new Envelope(MessageTypes.HEARTBEAT_ACK, null, null, null, null);
    }

    public static Envelope log(String level, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("level", level);
        body.put("message", message);
        return new Envelope(MessageTypes.LOG, null, null, null, body);
    }
}

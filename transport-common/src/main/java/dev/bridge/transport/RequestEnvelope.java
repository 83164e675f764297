package dev.bridge.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * A single operation sent to the executor. {@code id} is unique for the lifetime of the
 * connection and is echoed back in the matching {@link ReplyEnvelope}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestEnvelope(String id, String kind, Map<String, Object> payload) {

    public RequestEnvelope {
        payload = payload == null ? Map.of() : payload;
    }
}

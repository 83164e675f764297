package dev.bridge.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Executor answer to a {@link RequestEnvelope}. Exactly one of {@code result} and
 * {@code error} is meaningful, selected by {@code ok}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplyEnvelope(String id, boolean ok, Object result, String error) {

    public static ReplyEnvelope success(String id, Object result) {
        return new ReplyEnvelope(id, true, result, null);
    }

    public static ReplyEnvelope failure(String id, String error) {
        return new ReplyEnvelope(id, false, null, error);
    }
}

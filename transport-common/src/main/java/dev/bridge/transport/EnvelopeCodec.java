package dev.bridge.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * JSON mapping between {@link Envelope} and frame text. Shared by both ends of the connection
 * so that they agree on the same mapper settings.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Envelope envelope) throws JsonProcessingException {
        return mapper.writeValueAsString(envelope);
    }

    public Envelope decode(String frame) throws IOException {
        Envelope envelope = mapper.readValue(frame, Envelope.class);
        if (envelope == null || envelope.type() == null) {
            throw new IOException("Frame has no message type");
        }
        return envelope;
    }
}

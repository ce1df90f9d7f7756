package com.example.chatsync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of sync envelopes. Unknown fields are tolerated, unknown types are not.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Envelope decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        Envelope envelope;
        try {
            envelope = objectMapper.readValue(frame, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed envelope: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || envelope.getType() == null) {
            throw new ProtocolException("Envelope has no type");
        }
        if (envelope.resolvedType() == null) {
            throw new ProtocolException("Unknown envelope type: " + envelope.getType());
        }
        return envelope;
    }

    public String encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode envelope of type " + envelope.getType(), e);
        }
    }
}

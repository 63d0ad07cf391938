package com.ybds.transport.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Inbound wire message: {@code {"type": "...", "topic": "...", "payload": ...}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(String type, String topic, JsonNode payload) {

    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Decode one text frame.
     *
     * @throws JsonProcessingException if the frame is not a JSON object of the expected shape
     */
    public static Envelope parse(String raw) throws JsonProcessingException {
        return MAPPER.readValue(raw, Envelope.class);
    }

    public boolean hasTopic() {
        return topic != null && !topic.isEmpty();
    }

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope not serializable", e);
        }
    }
}

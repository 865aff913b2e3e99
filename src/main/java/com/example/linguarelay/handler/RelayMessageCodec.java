package com.example.linguarelay.handler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON framing for the relay socket: every frame is {@code {"event": "...", "data": {...}}}.
 */
@Component
public class RelayMessageCodec {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /** One decoded frame; {@code data} is never null (an empty object when the client sent none). */
    public record Envelope(String event, JsonNode data) { }

    /** Empty for anything that is not a JSON object with a textual "event". */
    public Optional<Envelope> decode(String frame) {
        if (frame == null || frame.isBlank()) return Optional.empty();
        try {
            JsonNode root = objectMapper.readTree(frame);
            if (root == null || !root.isObject()) return Optional.empty();
            JsonNode event = root.get("event");
            if (event == null || !event.isTextual() || event.asText().isBlank()) return Optional.empty();
            JsonNode data = root.get("data");
            if (data == null || data.isNull()) data = objectMapper.createObjectNode();
            return Optional.of(new Envelope(event.asText(), data));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public <T> T payload(Envelope envelope, Class<T> type) throws JsonProcessingException {
        return objectMapper.treeToValue(envelope.data(), type);
    }

    /** Encodes an outgoing frame; {@code data} may be null for bare events such as heartbeat-ack. */
    public String encode(String event, Object data) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("event", event);
        if (data != null) root.set("data", objectMapper.valueToTree(data));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode '" + event + "' frame", e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}

package io.github.drompincen.agentlink.protocol.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Converts between transport text and {@link Frame}s. Anything that is not a JSON object is
 * reported as absent so callers can drop it without failing the consumption loop.
 */
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<Frame> decode(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node instanceof ObjectNode obj) {
                return Optional.of(Frame.of(obj));
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public String encode(Frame frame) {
        try {
            return objectMapper.writeValueAsString(frame.body());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Frame cannot be serialized: " + frame.type(), e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}

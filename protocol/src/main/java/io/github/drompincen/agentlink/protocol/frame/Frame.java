package io.github.drompincen.agentlink.protocol.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One discrete JSON message exchanged over the session connection.
 * The {@code body} is the complete wire object, {@code type} and {@code subtype} included.
 */
public record Frame(
        FrameType type,
        String subtype,
        ObjectNode body
) {
    public static Frame of(ObjectNode body) {
        FrameType type = FrameType.fromWire(body.path("type").asText(null));
        String subtype = body.hasNonNull("subtype") ? body.get("subtype").asText() : null;
        return new Frame(type, subtype, body);
    }

    public static Frame empty(FrameType type) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("type", type.wireName());
        return new Frame(type, null, body);
    }

    public boolean is(FrameType expectedType, String expectedSubtype) {
        return type == expectedType && expectedSubtype.equals(subtype);
    }

    public JsonNode get(String field) {
        return body.path(field);
    }

    public String text(String field) {
        JsonNode node = body.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    public String requestId() {
        return text("request_id");
    }

    public String uuid() {
        return text("uuid");
    }

    public JsonNode messageContent() {
        return body.path("message").path("content");
    }
}

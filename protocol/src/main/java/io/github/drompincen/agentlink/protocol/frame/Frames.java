package io.github.drompincen.agentlink.protocol.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Builders for the frames the client sends.
 */
public final class Frames {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Frames() {}

    public static Frame initialize() {
        ObjectNode capabilities = NODES.objectNode();
        capabilities.put("permissions", true);
        capabilities.put("file_diffs", true);
        capabilities.put("user_questions", true);
        ObjectNode body = control("initialize");
        body.set("capabilities", capabilities);
        return Frame.of(body);
    }

    public static Frame userMessage(String text, String mode, List<String> contextFiles) {
        ObjectNode body = NODES.objectNode();
        body.put("type", FrameType.USER.wireName());
        ObjectNode message = body.putObject("message");
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject().put("type", "text").put("text", text);
        if (mode != null) body.put("mode", mode);
        if (contextFiles != null) {
            ArrayNode files = body.putArray("context_files");
            contextFiles.forEach(files::add);
        }
        return Frame.of(body);
    }

    public static Frame interrupt() {
        return Frame.of(control("interrupt"));
    }

    public static Frame control(String subtype, Map<String, ?> fields) {
        ObjectNode body = control(subtype);
        fields.forEach((k, v) -> body.set(k, toNode(v)));
        return Frame.of(body);
    }

    public static Frame allow(String requestId, JsonNode toolInput, JsonNode updatedInput,
                              JsonNode permissionSuggestions) {
        ObjectNode body = response(requestId);
        body.put("decision", "allow");
        body.set("tool_input", toolInput != null ? toolInput : NODES.objectNode());
        if (updatedInput != null) body.set("updatedInput", updatedInput);
        if (permissionSuggestions != null) body.set("permission_suggestions", permissionSuggestions);
        return Frame.of(body);
    }

    public static Frame deny(String requestId, JsonNode toolInput, String message) {
        ObjectNode body = response(requestId);
        body.put("decision", "deny");
        body.set("tool_input", toolInput != null ? toolInput : NODES.objectNode());
        if (message != null) body.put("message", message);
        return Frame.of(body);
    }

    public static Frame answers(String requestId, ObjectNode answers) {
        ObjectNode body = response(requestId);
        body.set("answers", answers != null ? answers : NODES.objectNode());
        return Frame.of(body);
    }

    private static ObjectNode control(String subtype) {
        ObjectNode body = NODES.objectNode();
        body.put("type", FrameType.CONTROL.wireName());
        body.put("subtype", subtype);
        return body;
    }

    private static ObjectNode response(String requestId) {
        ObjectNode body = NODES.objectNode();
        body.put("type", FrameType.CONTROL_RESPONSE.wireName());
        body.put("request_id", requestId);
        return body;
    }

    private static JsonNode toNode(Object value) {
        if (value == null) return NODES.nullNode();
        if (value instanceof JsonNode node) return node;
        if (value instanceof String s) return NODES.textNode(s);
        if (value instanceof Integer i) return NODES.numberNode(i);
        if (value instanceof Long l) return NODES.numberNode(l);
        if (value instanceof Double d) return NODES.numberNode(d);
        if (value instanceof Boolean b) return NODES.booleanNode(b);
        return NODES.textNode(String.valueOf(value));
    }
}

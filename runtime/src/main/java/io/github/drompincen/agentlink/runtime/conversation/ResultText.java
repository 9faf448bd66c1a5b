package io.github.drompincen.agentlink.runtime.conversation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Extracts displayable text from the {@code result} field of a result frame.
 */
final class ResultText {

    private ResultText() {}

    static String extract(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) return "";
        if (raw.isTextual()) return raw.asText();
        for (String field : new String[]{"text", "message", "result"}) {
            JsonNode value = raw.get(field);
            if (value != null && value.isTextual()) return value.asText();
        }
        JsonNode content = raw.get("content");
        if (content == null) return "";
        if (content.isTextual()) return content.asText();
        if (content.isArray()) {
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText()) && !part.path("text").asText().isEmpty()) {
                    return part.path("text").asText();
                }
            }
        }
        return "";
    }

    /** Text of a tool result's {@code content}: a string, or the concatenated text items. */
    static String ofToolContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) return "";
        if (content.isTextual()) return content.asText();
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode item : content) {
                if (item.isTextual()) {
                    sb.append(item.asText());
                } else if (item.hasNonNull("text")) {
                    sb.append(item.get("text").asText());
                }
            }
            return sb.toString();
        }
        return content.toString();
    }
}

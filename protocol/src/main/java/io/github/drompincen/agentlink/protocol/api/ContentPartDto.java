package io.github.drompincen.agentlink.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable view of one part of a turn: either a text span or a tool invocation.
 */
public record ContentPartDto(
        PartKind kind,
        String text,
        String toolUseId,
        String toolName,
        JsonNode input,
        String output,
        ToolStatus status,
        String error,
        Integer lineCount
) {
    public enum PartKind {
        TEXT, TOOL_USE
    }

    public static ContentPartDto text(String text) {
        return new ContentPartDto(PartKind.TEXT, text, null, null, null, null, null, null, null);
    }

    public boolean isText() {
        return kind == PartKind.TEXT;
    }
}

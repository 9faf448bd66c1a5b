package io.github.drompincen.agentlink.protocol.api;

import java.util.List;

public record TurnSnapshot(
        String sessionId,
        List<ContentPartDto> parts,
        boolean complete
) {
    public TurnSnapshot {
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static TurnSnapshot empty(String sessionId) {
        return new TurnSnapshot(sessionId, List.of(), false);
    }

    public String joinedText() {
        StringBuilder sb = new StringBuilder();
        for (ContentPartDto part : parts) {
            if (part.isText() && part.text() != null) sb.append(part.text());
        }
        return sb.toString();
    }
}

package io.github.drompincen.agentlink.protocol.api;

import java.util.List;

public record SendMessageRequest(
        String content,
        List<String> contextFiles
) {
    public SendMessageRequest(String content) {
        this(content, null);
    }
}

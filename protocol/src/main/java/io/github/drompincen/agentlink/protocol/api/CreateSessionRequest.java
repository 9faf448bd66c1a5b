package io.github.drompincen.agentlink.protocol.api;

import java.util.List;

public record CreateSessionRequest(
        String sessionId,
        String mode,
        Boolean resume,
        SessionOptions options,
        List<FileReference> files
) {}

package io.github.drompincen.agentlink.protocol.api;

import java.util.List;

public record SessionDto(
        String sessionId,
        SessionMode mode,
        SessionOptions options,
        boolean connected,
        boolean streaming,
        TurnSnapshot currentTurn,
        List<PermissionRequestDto> pendingPrompts,
        List<ErrorNotice> errors,
        List<String> slashCommands
) {}

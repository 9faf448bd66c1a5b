package io.github.drompincen.agentlink.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record PermissionRequestDto(
        String requestId,
        String toolName,
        JsonNode toolInput,
        JsonNode permissionSuggestions,
        String blockedPath,
        PermissionSource source,
        PermissionState state,
        List<Question> questions,
        Instant createdAt
) {
    public enum PermissionSource {
        /** Native {@code control_request} prompt, answered with a {@code control_response}. */
        CONTROL_REQUEST,
        /** Permission prompt embedded in other frame kinds. */
        STREAM,
        /** Batch of structured questions. */
        USER_QUESTION,
        /** Informational notice that a tool was already blocked; dismiss only. */
        DENIAL
    }

    public enum PermissionState {
        PENDING, ALLOWED, DENIED, DISMISSED, CANCELLED;

        public boolean isTerminal() {
            return this != PENDING;
        }
    }

    public record Question(String question, boolean multiSelect) {}
}

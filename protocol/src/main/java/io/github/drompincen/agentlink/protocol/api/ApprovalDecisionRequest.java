package io.github.drompincen.agentlink.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Decision on a pending permission prompt. {@code decision} is {@code allow}, {@code deny}
 * or {@code dismiss}; {@code answers} is only used for question batches and is keyed by question
 * index or question text.
 */
public record ApprovalDecisionRequest(
        String decision,
        JsonNode updatedInput,
        String scope,
        String reason,
        String nextMode,
        Map<String, String> answers
) {}

package io.github.drompincen.agentlink.protocol.api;

import java.util.LinkedHashMap;
import java.util.Map;

public record SessionOptions(
        String model,
        Integer maxThinkingTokens,
        Integer maxTurns,
        Double maxBudgetUsd,
        String allowedTools,
        String disallowedTools
) {
    public static SessionOptions defaults() {
        return new SessionOptions(null, null, null, null, null, null);
    }

    public SessionOptions withModel(String newModel) {
        return new SessionOptions(newModel, maxThinkingTokens, maxTurns, maxBudgetUsd, allowedTools, disallowedTools);
    }

    public SessionOptions withMaxThinkingTokens(Integer tokens) {
        return new SessionOptions(model, tokens, maxTurns, maxBudgetUsd, allowedTools, disallowedTools);
    }

    /**
     * Normalized view of every option that can only take effect in a fresh remote process.
     * Two option sets with the same key never require a restart between them.
     */
    public String restartKey() {
        Map<String, String> normalized = new LinkedHashMap<>();
        normalized.put("model", trim(model));
        normalized.put("maxThinkingTokens", maxThinkingTokens != null ? maxThinkingTokens.toString() : "");
        normalized.put("maxTurns", maxTurns != null ? maxTurns.toString() : "");
        normalized.put("maxBudgetUsd", maxBudgetUsd != null ? maxBudgetUsd.toString() : "");
        normalized.put("allowedTools", trim(allowedTools));
        normalized.put("disallowedTools", trim(disallowedTools));
        return normalized.toString();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}

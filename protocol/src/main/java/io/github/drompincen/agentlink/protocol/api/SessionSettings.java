package io.github.drompincen.agentlink.protocol.api;

/**
 * Settings reported by the remote side, either on connect or as a control echo.
 * Null fields were not part of the report.
 */
public record SessionSettings(
        String model,
        Integer maxThinkingTokens,
        SessionMode mode,
        Boolean liveModeSwitch
) {
    public static SessionSettings ofModel(String model) {
        return new SessionSettings(model, null, null, null);
    }

    public static SessionSettings ofMaxThinkingTokens(int tokens) {
        return new SessionSettings(null, tokens, null, null);
    }

    public static SessionSettings ofMode(SessionMode mode) {
        return new SessionSettings(null, null, mode, null);
    }
}

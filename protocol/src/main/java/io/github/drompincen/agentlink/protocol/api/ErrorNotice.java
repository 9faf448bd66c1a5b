package io.github.drompincen.agentlink.protocol.api;

import java.time.Instant;
import java.util.List;

/**
 * A transport or session failure surfaced to the presentation layer.
 */
public record ErrorNotice(
        String title,
        String detail,
        List<String> suggestions,
        String source,
        boolean canRetry,
        boolean canRestart,
        Instant timestamp
) {
    public static final String SOURCE_CONNECTION = "connection";
    public static final String SOURCE_SESSION = "session";
    public static final String SOURCE_CONTROL = "control";

    public static ErrorNotice connection(String detail) {
        return new ErrorNotice("Connection error", detail,
                List.of("Make sure the backend is running.", "Try reconnecting or restarting the session."),
                SOURCE_CONNECTION, true, true, Instant.now());
    }

    public static ErrorNotice session(String detail) {
        return new ErrorNotice("Agent session error", detail,
                List.of("Check the agent output for details.", "Try restarting the session."),
                SOURCE_SESSION, true, true, Instant.now());
    }

    public static ErrorNotice control(String detail) {
        return new ErrorNotice("Agent control error", detail,
                List.of("Review the agent output for details.", "Retry the action after reconnecting."),
                SOURCE_CONTROL, true, true, Instant.now());
    }
}

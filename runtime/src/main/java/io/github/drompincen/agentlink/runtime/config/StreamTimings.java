package io.github.drompincen.agentlink.runtime.config;

import java.time.Duration;

/**
 * The only locally owned delays. Status transitions are advisory and never override a real
 * status signal that arrives first.
 */
public record StreamTimings(
        Duration reconnectDelay,
        Duration sessionNotFoundDelay,
        Duration pendingToRunning,
        Duration streamingToComplete,
        Duration approvedToComplete,
        Duration controlRetryInterval,
        int controlRetryAttempts
) {
    public static StreamTimings defaults() {
        return new StreamTimings(
                Duration.ofMillis(1000),
                Duration.ofMillis(100),
                Duration.ofMillis(120),
                Duration.ofMillis(160),
                Duration.ofMillis(180),
                Duration.ofMillis(500),
                10);
    }
}

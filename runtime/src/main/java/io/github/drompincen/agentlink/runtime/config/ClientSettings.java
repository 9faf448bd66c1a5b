package io.github.drompincen.agentlink.runtime.config;

import io.github.drompincen.agentlink.protocol.api.SessionMode;

public record ClientSettings(
        String endpoint,
        SessionMode defaultMode,
        StreamTimings timings
) {
    public ClientSettings {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        defaultMode = defaultMode != null ? defaultMode : SessionMode.ASK;
        timings = timings != null ? timings : StreamTimings.defaults();
    }
}

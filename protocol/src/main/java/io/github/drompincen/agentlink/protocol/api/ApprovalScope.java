package io.github.drompincen.agentlink.protocol.api;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where an approval is durably recorded by the remote side.
 */
public enum ApprovalScope {
    SESSION("session"),
    LOCAL_SETTINGS("localSettings"),
    PROJECT_SETTINGS("projectSettings"),
    USER_SETTINGS("userSettings");

    private final String destination;

    ApprovalScope(String destination) {
        this.destination = destination;
    }

    public String destination() {
        return destination;
    }

    public static Optional<ApprovalScope> fromDestination(String destination) {
        return Arrays.stream(values())
                .filter(s -> s.destination.equals(destination))
                .findFirst();
    }
}

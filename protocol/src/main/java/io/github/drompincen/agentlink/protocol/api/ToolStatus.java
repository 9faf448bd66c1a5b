package io.github.drompincen.agentlink.protocol.api;

public enum ToolStatus {
    PENDING,
    RUNNING,
    STREAMING,
    COMPLETE,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}

package io.github.drompincen.agentlink.runtime.connection;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
}

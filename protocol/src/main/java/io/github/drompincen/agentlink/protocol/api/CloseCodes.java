package io.github.drompincen.agentlink.protocol.api;

/**
 * Transport close codes the client reacts to.
 */
public final class CloseCodes {

    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    /** Connection lost without a close handshake; the only code that triggers a reconnect. */
    public static final int ABNORMAL = 1006;

    private CloseCodes() {}
}

package io.github.drompincen.agentlink.runtime.connection;

import java.io.IOException;

/**
 * Text-message transport to the remote agent process.
 */
public interface Transport {

    void send(String text) throws IOException;

    boolean isOpen();

    /** Closes the transport; the listener is notified with the given code. */
    void close(int code, String reason);
}

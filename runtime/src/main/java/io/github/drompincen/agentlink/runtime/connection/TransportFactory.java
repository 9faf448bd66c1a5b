package io.github.drompincen.agentlink.runtime.connection;

import java.net.URI;

public interface TransportFactory {

    /**
     * Starts connecting to {@code target}. Returns immediately; {@link TransportListener#onOpen()}
     * fires once the transport can send.
     */
    Transport open(URI target, TransportListener listener);
}

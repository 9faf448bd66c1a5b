package io.github.drompincen.agentlink.gateway.websocket;

import io.github.drompincen.agentlink.protocol.api.CloseCodes;
import io.github.drompincen.agentlink.runtime.connection.Transport;
import io.github.drompincen.agentlink.runtime.connection.TransportFactory;
import io.github.drompincen.agentlink.runtime.connection.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;

/**
 * Opens agent stream connections with Spring's standard WebSocket client. A failed handshake
 * is reported like a browser reports it: an error followed by an abnormal close.
 */
@Component
public class SpringWebSocketTransportFactory implements TransportFactory {

    private static final Logger log = LoggerFactory.getLogger(SpringWebSocketTransportFactory.class);

    private final WebSocketClient client;

    public SpringWebSocketTransportFactory() {
        this(new StandardWebSocketClient());
    }

    SpringWebSocketTransportFactory(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public Transport open(URI target, TransportListener listener) {
        WebSocketTransport transport = new WebSocketTransport();
        AgentStreamWebSocketHandler handler = new AgentStreamWebSocketHandler(transport, listener);
        client.execute(handler, new WebSocketHttpHeaders(), target).whenComplete((session, error) -> {
            if (error != null) {
                log.warn("WebSocket handshake with {} failed: {}", target, error.getMessage());
                listener.onError(error);
                listener.onClose(CloseCodes.ABNORMAL, "handshake failed");
            }
        });
        return transport;
    }
}

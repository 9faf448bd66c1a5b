package io.github.drompincen.agentlink.gateway.websocket;

import io.github.drompincen.agentlink.runtime.connection.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Client-side handler of one agent stream connection. Spring callbacks are forwarded to the
 * runtime's {@link TransportListener}; nothing else happens on the WebSocket thread.
 */
public class AgentStreamWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentStreamWebSocketHandler.class);

    private final WebSocketTransport transport;
    private final TransportListener listener;

    public AgentStreamWebSocketHandler(WebSocketTransport transport, TransportListener listener) {
        this.transport = transport;
        this.listener = listener;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        if (transport.bind(session)) {
            log.debug("Agent stream {} established", session.getId());
            listener.onOpen();
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        listener.onText(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        listener.onError(exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        listener.onClose(status.getCode(), status.getReason());
    }
}

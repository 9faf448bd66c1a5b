package io.github.drompincen.agentlink.gateway.websocket;

import io.github.drompincen.agentlink.runtime.connection.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link Transport} over a Spring {@link WebSocketSession}. The session is bound once the
 * handshake completes; a close requested before that closes the session as soon as it binds.
 */
public class WebSocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private WebSocketSession session;
    private CloseStatus pendingClose;

    /** @return false when the transport was closed before the handshake completed */
    synchronized boolean bind(WebSocketSession session) {
        this.session = session;
        if (pendingClose != null) {
            closeQuietly(pendingClose);
            return false;
        }
        return true;
    }

    @Override
    public synchronized void send(String text) throws IOException {
        if (session == null || !session.isOpen()) {
            throw new IOException("WebSocket is not open");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public synchronized boolean isOpen() {
        return session != null && session.isOpen();
    }

    @Override
    public synchronized void close(int code, String reason) {
        CloseStatus status = new CloseStatus(code, reason);
        if (session == null) {
            pendingClose = status;
            return;
        }
        closeQuietly(status);
    }

    private void closeQuietly(CloseStatus status) {
        try {
            if (session.isOpen()) session.close(status);
        } catch (IOException e) {
            log.warn("Error closing WebSocket {}: {}", session.getId(), e.getMessage());
        }
    }
}

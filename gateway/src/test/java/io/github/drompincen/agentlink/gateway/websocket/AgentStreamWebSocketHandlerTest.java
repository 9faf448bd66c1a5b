package io.github.drompincen.agentlink.gateway.websocket;

import io.github.drompincen.agentlink.runtime.connection.TransportListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentStreamWebSocketHandlerTest {

    @Mock private TransportListener listener;
    @Mock private WebSocketSession wsSession;

    private WebSocketTransport transport;
    private AgentStreamWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        transport = new WebSocketTransport();
        handler = new AgentStreamWebSocketHandler(transport, listener);
    }

    @Test
    void establishedConnectionOpensTransport() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);

        handler.afterConnectionEstablished(wsSession);

        verify(listener).onOpen();
        assertThat(transport.isOpen()).isTrue();
    }

    @Test
    void textIsForwarded() throws Exception {
        handler.handleTextMessage(wsSession, new TextMessage("{\"type\":\"assistant\"}"));

        verify(listener).onText("{\"type\":\"assistant\"}");
    }

    @Test
    void closeIsForwardedWithCodeAndReason() throws Exception {
        handler.afterConnectionClosed(wsSession, new CloseStatus(1006, "gone"));

        verify(listener).onClose(1006, "gone");
    }

    @Test
    void transportErrorIsForwarded() throws Exception {
        IOException error = new IOException("reset");

        handler.handleTransportError(wsSession, error);

        verify(listener).onError(error);
    }

    @Test
    void closeRequestedBeforeHandshakeClosesOnBind() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);
        transport.close(1000, "superseded");

        handler.afterConnectionEstablished(wsSession);

        verify(wsSession).close(new CloseStatus(1000, "superseded"));
        verify(listener, never()).onOpen();
    }

    @Test
    void sendWritesTextMessage() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(wsSession);

        transport.send("{\"type\":\"control\"}");

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(wsSession).sendMessage(captor.capture());
        assertThat(captor.getValue().getPayload()).isEqualTo("{\"type\":\"control\"}");
    }

    @Test
    void sendBeforeHandshakeFails() {
        assertThatThrownBy(() -> transport.send("x")).isInstanceOf(IOException.class);
        assertThat(transport.isOpen()).isFalse();
    }
}

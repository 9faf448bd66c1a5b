package io.github.drompincen.agentlink.gateway.websocket;

import io.github.drompincen.agentlink.protocol.api.CloseCodes;
import io.github.drompincen.agentlink.runtime.connection.Transport;
import io.github.drompincen.agentlink.runtime.connection.TransportListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SpringWebSocketTransportFactoryTest {

    private static final URI TARGET = URI.create("ws://localhost:8765/ws?session_id=s1&mode=ask");

    @Mock private WebSocketClient client;
    @Mock private TransportListener listener;

    @Test
    void failedHandshakeIsReportedAsAbnormalClose() {
        IOException refused = new IOException("Connection refused");
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(TARGET)))
                .thenReturn(CompletableFuture.failedFuture(refused));

        Transport transport = new SpringWebSocketTransportFactory(client).open(TARGET, listener);

        assertThat(transport.isOpen()).isFalse();
        verify(listener).onError(refused);
        verify(listener).onClose(eq(CloseCodes.ABNORMAL), anyString());
    }

    @Test
    void pendingHandshakeReportsNothing() {
        when(client.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), eq(TARGET)))
                .thenReturn(new CompletableFuture<WebSocketSession>());

        new SpringWebSocketTransportFactory(client).open(TARGET, listener);

        verifyNoInteractions(listener);
    }
}

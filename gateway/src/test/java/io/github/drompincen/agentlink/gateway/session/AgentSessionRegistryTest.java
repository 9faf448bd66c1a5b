package io.github.drompincen.agentlink.gateway.session;

import io.github.drompincen.agentlink.protocol.api.CreateSessionRequest;
import io.github.drompincen.agentlink.protocol.api.FileReference;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.api.SessionOptions;
import io.github.drompincen.agentlink.runtime.session.AgentSession;
import io.github.drompincen.agentlink.runtime.session.AgentSessionFactory;
import io.github.drompincen.agentlink.runtime.session.SessionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentSessionRegistryTest {

    @Mock private AgentSessionFactory factory;
    @Mock private AgentSession session;

    private AgentSessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AgentSessionRegistry(factory);
    }

    @Test
    void createResumesRequestedSession() {
        SessionOptions options = new SessionOptions("opus", null, 3, null, null, null);
        List<FileReference> files = List.of(new FileReference("f1", "a.md"));
        when(factory.create(SessionMode.PLAN)).thenReturn(session);
        when(session.sessionId()).thenReturn("s1");

        AgentSession created = registry.create(new CreateSessionRequest("s1", "plan", true, options, files));

        assertThat(created).isSameAs(session);
        verify(session).changeOptions(options);
        verify(session).attachFiles(files);
        verify(session).switchSession("s1", true);
        verify(session, never()).connect();
        assertThat(registry.find("s1")).containsSame(session);
    }

    @Test
    void createWithoutIdConnectsFresh() {
        when(factory.create(null)).thenReturn(session);
        when(session.sessionId()).thenReturn("minted");

        registry.create(new CreateSessionRequest(null, null, null, null, null));

        verify(session).connect();
        assertThat(registry.find("minted")).isPresent();
    }

    @Test
    void unknownModeIsRejectedBeforeCreating() {
        assertThatThrownBy(() -> registry.create(new CreateSessionRequest(null, "yolo", null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(factory);
    }

    @Test
    void sessionIsReachableUnderAssignedIdAndClosedOnce() {
        when(factory.create(null)).thenReturn(session);
        when(session.sessionId()).thenReturn("local-1");
        registry.create(new CreateSessionRequest(null, null, null, null, null));

        ArgumentCaptor<SessionListener> listener = ArgumentCaptor.forClass(SessionListener.class);
        verify(session).addListener(listener.capture());
        listener.getValue().onSessionIdAssigned("remote-1");

        assertThat(registry.find("remote-1")).containsSame(session);
        assertThat(registry.all()).hasSize(1);

        assertThat(registry.close("remote-1")).isTrue();
        assertThat(registry.find("local-1")).isEmpty();
        assertThat(registry.close("local-1")).isFalse();
        verify(session, times(1)).close();
    }

    @Test
    void closeAllClosesEverySession() {
        when(factory.create(any())).thenReturn(session);
        when(session.sessionId()).thenReturn("s1");
        registry.create(new CreateSessionRequest(null, null, null, null, null));

        registry.closeAll();

        verify(session).close();
        assertThat(registry.all()).isEmpty();
    }
}

package io.github.drompincen.agentlink.runtime.session;

import io.github.drompincen.agentlink.protocol.api.FileReference;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.api.SessionOptions;
import io.github.drompincen.agentlink.protocol.api.SessionSettings;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import io.github.drompincen.agentlink.protocol.frame.FrameType;
import io.github.drompincen.agentlink.runtime.config.StreamTimings;
import io.github.drompincen.agentlink.runtime.connection.Connection;
import io.github.drompincen.agentlink.runtime.connection.ConnectionEvents;
import io.github.drompincen.agentlink.runtime.connection.ConnectionManager;
import io.github.drompincen.agentlink.runtime.support.FakeTransportFactory;
import io.github.drompincen.agentlink.runtime.support.ManualScheduler;
import io.github.drompincen.agentlink.runtime.support.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleControllerTest {

    @Mock
    private SessionDirectory directory;

    private FakeTransportFactory transports;
    private SessionLifecycleController lifecycle;

    @BeforeEach
    void setUp() {
        transports = new FakeTransportFactory();
        ConnectionManager manager = new ConnectionManager("ws://localhost:3000/ws", transports, TestFrames.CODEC,
                new ManualScheduler(), StreamTimings.defaults(), new ConnectionEvents() {});
        lifecycle = new SessionLifecycleController(manager, directory, SessionMode.ASK);
    }

    @Test
    void connectMintsSessionId() {
        lifecycle.connect();

        assertThat(lifecycle.sessionId()).isNotBlank();
        assertThat(transports.last().query()).isEqualTo("session_id=" + lifecycle.sessionId() + "&mode=ask");
    }

    @Test
    void modeChangeRestartsWithSameSessionId() {
        openAs("s1");

        assertThat(lifecycle.changeMode(SessionMode.PLAN)).isTrue();

        Frame control = TestFrames.CODEC.decode(transports.opened().get(0).sent().get(1)).orElseThrow();
        assertThat(control.is(FrameType.CONTROL, "set_permission_mode")).isTrue();
        assertThat(control.text("mode")).isEqualTo("plan");
        assertThat(transports.count()).isEqualTo(2);
        assertThat(transports.last().query()).isEqualTo("session_id=s1&mode=plan&force_new=1");
    }

    @Test
    void liveModeSwitchAvoidsRestart() {
        openAs("s1");
        lifecycle.onSettingsSync(new SessionSettings(null, null, null, true));

        lifecycle.changeMode(SessionMode.ACT);

        assertThat(transports.count()).isEqualTo(1);
        assertThat(lifecycle.mode()).isEqualTo(SessionMode.ACT);
        assertThat(transports.last().sent()).anyMatch(s -> s.contains("acceptEdits"));
    }

    @Test
    void unchangedModeDoesNothing() {
        openAs("s1");

        assertThat(lifecycle.changeMode(SessionMode.ASK)).isFalse();
        assertThat(transports.count()).isEqualTo(1);
    }

    @Test
    void modeChangeBeforeConnectForcesNewOnFirstConnect() {
        lifecycle.changeMode(SessionMode.PLAN);
        assertThat(transports.count()).isZero();

        lifecycle.switchSession("s1", false);

        assertThat(transports.last().query()).isEqualTo("session_id=s1&mode=plan&force_new=1");
        assertThat(lifecycle.needsRestart()).isFalse();
    }

    @Test
    void changedOptionsForceRestartOnNextConnect() {
        Connection first = openAs("s1");

        lifecycle.changeOptions(new SessionOptions(null, null, 5, null, null, null));
        assertThat(lifecycle.needsRestart()).isTrue();

        Connection second = lifecycle.ensureConnected();

        assertThat(second).isNotSameAs(first);
        assertThat(transports.last().query()).isEqualTo("session_id=s1&mode=ask&force_new=1&max_turns=5");
    }

    @Test
    void ensureConnectedReusesOpenConnection() {
        Connection first = openAs("s1");

        assertThat(lifecycle.ensureConnected()).isSameAs(first);
        assertThat(transports.count()).isEqualTo(1);
    }

    @Test
    void liveModelChangeDoesNotForceRestart() {
        openAs("s1");

        lifecycle.setModel("opus");

        assertThat(lifecycle.options().model()).isEqualTo("opus");
        assertThat(lifecycle.needsRestart()).isFalse();
        assertThat(transports.last().sent()).anyMatch(s -> s.contains("set_model"));
    }

    @Test
    void attachedFilesForceRestartAndSkipIncompleteReferences() {
        openAs("s1");

        lifecycle.attachFiles(List.of(new FileReference("f1", "docs/a.md"), new FileReference("f2", " ")));

        assertThat(lifecycle.files()).extracting(FileReference::fileId).containsExactly("f1");
        assertThat(lifecycle.needsRestart()).isTrue();
        lifecycle.ensureConnected();
        assertThat(transports.last().query()).endsWith("&force_new=1&file=f1%3Adocs%2Fa.md");
    }

    @Test
    void switchSessionResumes() {
        lifecycle.switchSession("old-1", true);

        assertThat(transports.last().query()).isEqualTo("session_id=old-1&mode=ask&resume=1");
        assertThatThrownBy(() -> lifecycle.switchSession(" ", true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void restartOfResumedSessionResumesAgain() {
        Connection resumed = lifecycle.switchSession("old-1", true);
        transports.last().accept();
        lifecycle.onOpened(resumed);

        lifecycle.restart();

        assertThat(transports.last().query()).isEqualTo("session_id=old-1&mode=ask&force_new=1&resume=1");
    }

    @Test
    void replacedSessionRestartsWithoutResume() {
        lifecycle.switchSession("old-1", true);
        lifecycle.onSessionReplaced("fresh-2");

        lifecycle.restart();

        assertThat(transports.last().query()).isEqualTo("session_id=fresh-2&mode=ask&force_new=1");
    }

    @Test
    void newSessionUsesDirectoryId() {
        when(directory.createSession()).thenReturn(Optional.of("fresh-1"));

        lifecycle.newSession();

        assertThat(lifecycle.sessionId()).isEqualTo("fresh-1");
        assertThat(transports.last().query()).isEqualTo("session_id=fresh-1&mode=ask");
    }

    @Test
    void newSessionFallsBackToLocalId() {
        when(directory.createSession()).thenReturn(Optional.empty());

        lifecycle.newSession();

        assertThat(lifecycle.sessionId()).isNotBlank();
    }

    @Test
    void remoteSettingsUpdateModeAndModel() {
        lifecycle.onSettingsSync(new SessionSettings("sonnet", null, SessionMode.PLAN, null));

        assertThat(lifecycle.options().model()).isEqualTo("sonnet");
        assertThat(lifecycle.mode()).isEqualTo(SessionMode.PLAN);
    }

    private Connection openAs(String sessionId) {
        Connection connection = lifecycle.switchSession(sessionId, false);
        transports.last().accept();
        lifecycle.onOpened(connection);
        return connection;
    }
}

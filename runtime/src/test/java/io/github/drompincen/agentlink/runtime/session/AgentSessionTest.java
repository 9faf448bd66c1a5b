package io.github.drompincen.agentlink.runtime.session;

import io.github.drompincen.agentlink.protocol.api.CloseCodes;
import io.github.drompincen.agentlink.protocol.api.ErrorNotice;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.PermissionState;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.api.ToolStatus;
import io.github.drompincen.agentlink.protocol.api.TurnSnapshot;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import io.github.drompincen.agentlink.protocol.frame.FrameType;
import io.github.drompincen.agentlink.runtime.config.ClientSettings;
import io.github.drompincen.agentlink.runtime.connection.ConnectionState;
import io.github.drompincen.agentlink.runtime.support.FakeTransportFactory;
import io.github.drompincen.agentlink.runtime.support.FakeTransportFactory.FakeTransport;
import io.github.drompincen.agentlink.runtime.support.ManualScheduler;
import io.github.drompincen.agentlink.runtime.support.TestFrames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static io.github.drompincen.agentlink.runtime.support.TestFrames.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentSessionTest {

    private ManualScheduler scheduler;
    private FakeTransportFactory transports;
    private AgentSession session;
    private final List<ConnectionState> states = new CopyOnWriteArrayList<>();
    private final List<PermissionRequestDto> requested = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        transports = new FakeTransportFactory();
        session = new AgentSession(new ClientSettings("ws://localhost:3000/ws", SessionMode.ASK, null),
                transports, TestFrames.CODEC, scheduler, SessionDirectory.local(), null);
        session.addListener(new SessionListener() {
            @Override
            public void onConnectionStateChanged(ConnectionState state) {
                states.add(state);
            }

            @Override
            public void onPermissionRequested(PermissionRequestDto request) {
                requested.add(request);
            }
        });
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void messageIsSentAfterInitializeOnceOpen() throws Exception {
        CompletableFuture<Void> delivered = session.sendMessage("hello", List.of("a.md"));
        assertThat(delivered).isNotDone();
        assertThat(session.isStreaming()).isTrue();

        transports.last().accept();
        delivered.get(2, TimeUnit.SECONDS);

        List<Frame> sent = sentFrames(transports.last());
        assertThat(sent).hasSize(2);
        assertThat(sent.get(0).is(FrameType.CONTROL, "initialize")).isTrue();
        Frame message = sent.get(1);
        assertThat(message.type()).isEqualTo(FrameType.USER);
        assertThat(message.text("mode")).isEqualTo("ask");
        assertThat(message.messageContent().get(0).path("text").asText()).isEqualTo("hello");
        assertThat(message.get("context_files").get(0).asText()).isEqualTo("a.md");
        assertThat(states).contains(ConnectionState.CONNECTING, ConnectionState.OPEN);
    }

    @Test
    void streamedTurnEndsWithResult() throws Exception {
        FakeTransport transport = openWithMessage("list files");

        transport.receive(json("{'type':'assistant','message':{'content':["
                + "{'type':'text','text':'Listing'},"
                + "{'type':'tool_use','id':'t1','name':'Bash','input':{'command':'ls'}}]}}"));
        transport.receive(json("{'type':'user','uuid':'u1','message':{'content':["
                + "{'type':'tool_result','tool_use_id':'t1','content':'a.txt'}]}}"));
        transport.receive(json("{'type':'result','result':'ignored'}"));

        await(() -> !session.isStreaming());
        TurnSnapshot turn = session.currentTurn();
        assertThat(turn.complete()).isTrue();
        assertThat(turn.joinedText()).isEqualTo("Listing");
        assertThat(turn.parts().get(1).status()).isEqualTo(ToolStatus.COMPLETE);
        assertThat(turn.parts().get(1).output()).isEqualTo("a.txt");
    }

    @Test
    void controlRequestIsApprovedOverTheWire() throws Exception {
        FakeTransport transport = openWithMessage("edit it");

        transport.receive(json("{'type':'control_request','request_id':'r1','request':{"
                + "'tool_name':'Edit','tool_use_id':'t1','input':{'file_path':'a.txt'}}}"));
        await(() -> !session.pendingPrompts().isEmpty());
        assertThat(requested).extracting(PermissionRequestDto::requestId).containsExactly("r1");

        PermissionRequestDto approved = session.approve("r1", null, null);

        assertThat(approved.state()).isEqualTo(PermissionState.ALLOWED);
        Frame response = sentFrames(transport).get(2);
        assertThat(response.type()).isEqualTo(FrameType.CONTROL_RESPONSE);
        assertThat(response.text("decision")).isEqualTo("allow");
        assertThat(session.currentTurn().parts().get(0).status()).isEqualTo(ToolStatus.RUNNING);
    }

    @Test
    void denialInResultKeepsStreamingUntilDismissed() throws Exception {
        FakeTransport transport = openWithMessage("write it");

        transport.receive(json("{'type':'result','permission_denials':[{'tool_name':'Write','tool_use_id':'t9'}]}"));
        await(() -> !session.pendingPrompts().isEmpty());
        assertThat(session.isStreaming()).isTrue();

        session.dismiss("t9");

        assertThat(session.isStreaming()).isFalse();
    }

    @Test
    void lostConnectionEndsTheTurnAndReconnects() throws Exception {
        FakeTransport transport = openWithMessage("long task");
        transport.receive(json("{'type':'assistant','message':{'content':'working'}}"));
        await(() -> session.currentTurn().joinedText().equals("working"));

        transport.drop(CloseCodes.ABNORMAL);

        await(() -> !session.isStreaming());
        assertThat(session.currentTurn().complete()).isTrue();
        assertThat(states).contains(ConnectionState.CLOSED);

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(transports.count()).isEqualTo(2);
        assertThat(transports.last().query()).startsWith("session_id=" + session.sessionId());
    }

    @Test
    void controlErrorIsRecorded() throws Exception {
        FakeTransport transport = openWithMessage("hi");

        transport.receive(json("{'type':'control','subtype':'error','error':{'message':'bad mode'}}"));

        await(() -> !session.errors().isEmpty());
        ErrorNotice notice = session.errors().get(0);
        assertThat(notice.detail()).isEqualTo("bad mode");
        assertThat(notice.source()).isEqualTo(ErrorNotice.SOURCE_CONTROL);
    }

    @Test
    void remoteModeEchoUpdatesSessionMode() throws Exception {
        FakeTransport transport = openWithMessage("hi");

        transport.receive(json("{'type':'control','subtype':'set_permission_mode','mode':'plan'}"));

        await(() -> session.mode() == SessionMode.PLAN);
    }

    @Test
    void clearCommandIsForwardedAndClearsTheTurn() throws Exception {
        FakeTransport transport = openWithMessage("first");
        transport.receive(json("{'type':'assistant','message':{'content':'answer'}}"));
        await(() -> !session.currentTurn().parts().isEmpty());

        session.sendMessage("/clear", null).get(2, TimeUnit.SECONDS);

        assertThat(sentFrames(transport).get(2).messageContent().get(0).path("text").asText()).isEqualTo("/clear");
        assertThat(session.currentTurn().parts()).isEmpty();
        assertThat(session.isStreaming()).isFalse();
    }

    @Test
    void blankMessageIsRejected() {
        assertThatThrownBy(() -> session.sendMessage("  ", null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(transports.count()).isZero();
    }

    @Test
    void slashCommandsAreExposed() throws Exception {
        FakeTransport transport = openWithMessage("hi");

        transport.receive(json("{'type':'system','subtype':'init','slash_commands':['clear','compact']}"));

        assertThat(session.slashCommands()).containsExactly("clear", "compact");
    }

    private FakeTransport openWithMessage(String text) throws Exception {
        CompletableFuture<Void> delivered = session.sendMessage(text, null);
        FakeTransport transport = transports.last();
        transport.accept();
        delivered.get(2, TimeUnit.SECONDS);
        return transport;
    }

    private static List<Frame> sentFrames(FakeTransport transport) {
        return transport.sent().stream().map(s -> TestFrames.CODEC.decode(s).orElseThrow()).toList();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within 2s");
            }
            Thread.sleep(10);
        }
    }
}

package io.github.drompincen.agentlink.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentlink.protocol.api.ApprovalScope;
import io.github.drompincen.agentlink.protocol.api.ErrorNotice;
import io.github.drompincen.agentlink.protocol.api.FileReference;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentlink.protocol.api.SessionDto;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.api.SessionOptions;
import io.github.drompincen.agentlink.protocol.api.SessionSettings;
import io.github.drompincen.agentlink.protocol.api.TurnSnapshot;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import io.github.drompincen.agentlink.protocol.frame.FrameCodec;
import io.github.drompincen.agentlink.protocol.frame.Frames;
import io.github.drompincen.agentlink.runtime.config.ClientSettings;
import io.github.drompincen.agentlink.runtime.connection.Connection;
import io.github.drompincen.agentlink.runtime.connection.ConnectionEvents;
import io.github.drompincen.agentlink.runtime.connection.ConnectionManager;
import io.github.drompincen.agentlink.runtime.connection.ConnectionState;
import io.github.drompincen.agentlink.runtime.connection.TransportFactory;
import io.github.drompincen.agentlink.runtime.conversation.ConversationReconstructor;
import io.github.drompincen.agentlink.runtime.conversation.ToolCallCorrelator;
import io.github.drompincen.agentlink.runtime.permission.PermissionHandshake;
import io.github.drompincen.agentlink.runtime.permission.PermissionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * One conversation with the remote agent. Inbound frames are processed by a single consumption
 * loop; user actions become outbound frames without waiting for the matching inbound ones.
 */
public class AgentSession implements ConnectionEvents {

    private static final Logger log = LoggerFactory.getLogger(AgentSession.class);
    private static final int MAX_ERRORS = 20;

    private final Object lock = new Object();
    private final ExecutorService consumer;
    private final ConnectionManager connectionManager;
    private final ConversationReconstructor reconstructor;
    private final PermissionHandshake handshake;
    private final SessionLifecycleController lifecycle;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<ErrorNotice> errors = new CopyOnWriteArrayList<>();
    private volatile List<String> slashCommands = List.of();
    private volatile boolean streaming;
    private long turnGeneration;

    public AgentSession(ClientSettings settings, TransportFactory transportFactory, FrameCodec codec,
                        ScheduledExecutorService scheduler, SessionDirectory directory, SessionMode initialMode) {
        this.consumer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agent-session-loop");
            t.setDaemon(true);
            return t;
        });
        this.connectionManager = new ConnectionManager(settings.endpoint(), transportFactory, codec,
                scheduler, settings.timings(), this);
        this.reconstructor = new ConversationReconstructor(
                new ToolCallCorrelator(scheduler, settings.timings(), this::publishTurn));
        this.handshake = new PermissionHandshake(connectionManager, reconstructor);
        this.lifecycle = new SessionLifecycleController(connectionManager, directory,
                initialMode != null ? initialMode : settings.defaultMode());
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // ---- outbound user actions ----

    public Connection connect() {
        return lifecycle.ensureConnected();
    }

    /**
     * Sends a user message and starts a new turn. {@code /clear} is forwarded and then clears the
     * local turn; {@code /restart} restarts the session locally.
     */
    public CompletableFuture<Void> sendMessage(String text, List<String> contextFiles) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("message text is required");
        }
        String trimmed = text.trim();
        if ("/restart".equals(trimmed)) {
            restart();
            return CompletableFuture.completedFuture(null);
        }
        Connection connection;
        SessionMode mode;
        synchronized (lock) {
            connection = lifecycle.ensureConnected();
            mode = lifecycle.mode();
            if (!"/clear".equals(trimmed)) {
                reconstructor.beginTurn();
                handshake.clear();
                turnGeneration = connection.generation();
                setStreaming(true);
                publishTurn();
            }
        }
        Frame frame = Frames.userMessage(text, mode.wireName(), contextFiles);
        return connection.whenOpen().thenAccept(open -> {
            if (!connectionManager.send(open, frame)) {
                throw new IllegalStateException("Message not delivered: connection is not open");
            }
            if ("/clear".equals(trimmed)) {
                clearHistory();
            }
        });
    }

    public boolean interrupt() {
        log.info("Interrupting session {}", lifecycle.sessionId());
        return connectionManager.send(Frames.interrupt());
    }

    public PermissionRequestDto approve(String requestId, JsonNode updatedInput, ApprovalScope scope) {
        synchronized (lock) {
            PermissionRequest request = handshake.allow(requestId, updatedInput, scope);
            return resolved(request);
        }
    }

    /** Approves leaving plan mode and continues in {@code nextMode}. */
    public PermissionRequestDto approvePlanExit(String requestId, SessionMode nextMode) {
        SessionMode target;
        PermissionRequestDto dto;
        synchronized (lock) {
            target = handshake.allowPlanExit(requestId, nextMode);
            dto = resolved(handshake.find(requestId).orElseThrow());
        }
        changeMode(target);
        return dto;
    }

    public PermissionRequestDto deny(String requestId, String reason) {
        synchronized (lock) {
            return resolved(handshake.deny(requestId, reason));
        }
    }

    public PermissionRequestDto dismiss(String requestId) {
        synchronized (lock) {
            PermissionRequestDto dto = resolved(handshake.dismiss(requestId));
            if (!reconstructor.isTurnActive() && handshake.pending().isEmpty()) {
                setStreaming(false);
            }
            return dto;
        }
    }

    public PermissionRequestDto answerQuestion(String requestId, String question, String answer) {
        synchronized (lock) {
            return handshake.answer(requestId, question, answer).toDto();
        }
    }

    public PermissionRequestDto submitAnswers(String requestId) {
        synchronized (lock) {
            return resolved(handshake.submitAnswers(requestId));
        }
    }

    public boolean changeMode(SessionMode mode) {
        return lifecycle.changeMode(mode);
    }

    public void setModel(String model) {
        lifecycle.setModel(model);
    }

    public void setMaxThinkingTokens(int tokens) {
        lifecycle.setMaxThinkingTokens(tokens);
    }

    public void changeOptions(SessionOptions options) {
        lifecycle.changeOptions(options);
    }

    public void attachFiles(List<FileReference> files) {
        lifecycle.attachFiles(files);
    }

    /** Fresh remote process for the same session; the local turn is cleared. */
    public Connection restart() {
        clearHistory();
        return lifecycle.restart();
    }

    public Connection switchSession(String sessionId, boolean resume) {
        clearHistory();
        return lifecycle.switchSession(sessionId, resume);
    }

    public Connection newSession() {
        clearHistory();
        return lifecycle.newSession();
    }

    public void close() {
        lifecycle.close();
        consumer.shutdown();
    }

    // ---- observable state ----

    public String sessionId() {
        return lifecycle.sessionId();
    }

    public SessionMode mode() {
        return lifecycle.mode();
    }

    public SessionOptions options() {
        return lifecycle.options();
    }

    public boolean isStreaming() {
        return streaming;
    }

    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    public TurnSnapshot currentTurn() {
        synchronized (lock) {
            return reconstructor.snapshot(lifecycle.sessionId());
        }
    }

    public List<PermissionRequestDto> pendingPrompts() {
        synchronized (lock) {
            return handshake.pending().stream().map(PermissionRequest::toDto).toList();
        }
    }

    public List<ErrorNotice> errors() {
        return List.copyOf(errors);
    }

    public List<String> slashCommands() {
        return slashCommands;
    }

    public SessionDto toDto() {
        return new SessionDto(sessionId(), mode(), options(), isConnected(), streaming, currentTurn(),
                pendingPrompts(), errors(), slashCommands);
    }

    // ---- connection events ----
    // Called from the transport and scheduler threads, sometimes while the connection manager
    // holds its own lock: none of these may take the session lock.

    @Override
    public void onConnectionOpening(Connection connection) {
        consumer.submit(() -> drain(connection));
        notifyListeners(l -> l.onConnectionStateChanged(ConnectionState.CONNECTING));
    }

    @Override
    public void onConnected(Connection connection) {
        lifecycle.onOpened(connection);
        notifyListeners(l -> l.onConnectionStateChanged(ConnectionState.OPEN));
    }

    @Override
    public void onDisconnected(Connection connection, int code) {
        notifyListeners(l -> l.onConnectionStateChanged(ConnectionState.CLOSED));
    }

    @Override
    public void onSessionIdAssigned(String sessionId) {
        lifecycle.onSessionIdAssigned(sessionId);
        notifyListeners(l -> l.onSessionIdAssigned(sessionId));
    }

    @Override
    public void onSessionReplaced(String oldSessionId, String newSessionId) {
        lifecycle.onSessionReplaced(newSessionId);
        notifyListeners(l -> l.onSessionIdAssigned(newSessionId));
    }

    @Override
    public void onSettings(SessionSettings settings) {
        lifecycle.onSettingsSync(settings);
        notifyListeners(l -> l.onSettingsChanged(settings));
    }

    @Override
    public void onSlashCommands(List<String> commands) {
        slashCommands = List.copyOf(commands);
        notifyListeners(l -> l.onSlashCommands(slashCommands));
    }

    @Override
    public void onError(ErrorNotice notice) {
        errors.add(notice);
        while (errors.size() > MAX_ERRORS) {
            errors.remove(0);
        }
        notifyListeners(l -> l.onError(notice));
    }

    // ---- consumption loop ----

    private void drain(Connection connection) {
        log.debug("Consumption loop attached to {}", connection);
        try {
            while (true) {
                Optional<Frame> next = connection.queue().next();
                if (next.isEmpty()) break;
                synchronized (lock) {
                    try {
                        dispatch(next.get());
                    } catch (RuntimeException e) {
                        log.error("Failed to process {} frame on {}", next.get().type().wireName(), connection, e);
                    }
                    publishTurn();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        synchronized (lock) {
            if (reconstructor.isTurnActive() && turnGeneration <= connection.generation()) {
                log.info("Connection {} done, ending the active turn", connection);
                reconstructor.endTurn();
                setStreaming(false);
                publishTurn();
            }
        }
    }

    private void dispatch(Frame frame) {
        switch (frame.type()) {
            case ASSISTANT -> {
                reconstructor.onAssistant(frame);
                setStreaming(true);
            }
            case USER -> reconstructor.onUser(frame);
            case RESULT -> onResult(frame);
            case CONTROL_REQUEST -> {
                requested(handshake.onControlRequest(frame));
                setStreaming(true);
            }
            case CONTROL_CANCEL_REQUEST -> handshake.onCancel(frame.requestId()).forEach(this::resolved);
            case CONTROL -> onControl(frame);
            case SYSTEM -> {
                if ("permission_request".equals(frame.subtype())) requested(handshake.onStreamPermission(frame));
            }
            case PERMISSION_REQUEST, APPROVAL_REQUEST, INPUT_REQUEST, USER_INPUT_REQUEST ->
                    requested(handshake.onStreamPermission(frame));
            default -> log.debug("Ignoring frame of type {}", frame.body().path("type").asText());
        }
    }

    private void onResult(Frame frame) {
        reconstructor.onResult(frame);
        Optional<PermissionRequest> denial = handshake.onDenials(frame);
        if (denial.isPresent()) {
            requested(denial.get());
            return;
        }
        handshake.dismissOutstanding();
        setStreaming(false);
    }

    private void onControl(Frame frame) {
        String subtype = frame.subtype() != null ? frame.subtype() : "";
        switch (subtype) {
            case "user_question_request" -> requested(handshake.onUserQuestion(frame));
            case "permission_request" -> requested(handshake.onStreamPermission(frame));
            case "set_permission_mode" -> onSettings(SessionSettings.ofMode(SessionMode.fromControl(frame.text("mode"))));
            case "set_model" -> {
                if (frame.text("model") != null) onSettings(SessionSettings.ofModel(frame.text("model")));
            }
            case "set_max_thinking_tokens" -> {
                JsonNode tokens = frame.get("max_thinking_tokens");
                if (tokens.isNumber() || tokens.isTextual()) {
                    onSettings(SessionSettings.ofMaxThinkingTokens(tokens.asInt()));
                }
            }
            case "error" -> {
                String detail = Optional.ofNullable(frame.get("error").path("message").textValue())
                        .or(() -> Optional.ofNullable(frame.text("message")))
                        .orElse("An unknown error occurred.");
                onError(ErrorNotice.control(detail));
            }
            default -> log.debug("Ignoring control frame {}", subtype);
        }
    }

    private void requested(PermissionRequest request) {
        PermissionRequestDto dto = request.toDto();
        notifyListeners(l -> l.onPermissionRequested(dto));
    }

    private PermissionRequestDto resolved(PermissionRequest request) {
        PermissionRequestDto dto = request.toDto();
        notifyListeners(l -> l.onPermissionResolved(dto));
        publishTurn();
        return dto;
    }

    private void clearHistory() {
        synchronized (lock) {
            reconstructor.clear();
            handshake.clear();
            setStreaming(false);
        }
        notifyListeners(SessionListener::onHistoryCleared);
    }

    private void setStreaming(boolean value) {
        if (streaming == value) return;
        streaming = value;
        notifyListeners(l -> l.onStreamingChanged(value));
    }

    private void publishTurn() {
        TurnSnapshot snapshot;
        synchronized (lock) {
            snapshot = reconstructor.snapshot(lifecycle.sessionId());
        }
        notifyListeners(l -> l.onTurnUpdated(snapshot));
    }

    private void notifyListeners(Consumer<SessionListener> callback) {
        for (SessionListener listener : new ArrayList<>(listeners)) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Session listener failed: {}", e.getMessage());
            }
        }
    }
}

package io.github.drompincen.agentlink.runtime.session;

import io.github.drompincen.agentlink.protocol.api.ConnectionParams;
import io.github.drompincen.agentlink.protocol.api.FileReference;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.api.SessionOptions;
import io.github.drompincen.agentlink.protocol.api.SessionSettings;
import io.github.drompincen.agentlink.runtime.connection.Connection;
import io.github.drompincen.agentlink.runtime.connection.ConnectionManager;
import io.github.drompincen.agentlink.runtime.connection.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Decides when to open, resume or hard-restart the remote session. Options and attachments
 * are compared against what the last successful open carried; any difference makes the next
 * connect a {@code force_new} one.
 */
public class SessionLifecycleController {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleController.class);

    private final ConnectionManager connectionManager;
    private final SessionDirectory directory;

    private String sessionId;
    private SessionMode mode;
    private SessionOptions options = SessionOptions.defaults();
    private List<FileReference> files = List.of();
    private boolean resumeNext;
    private boolean resumed;
    private boolean hardRestartPending;
    private boolean liveModeSwitch;
    private String openedOptionsKey;
    private String openedFilesKey = "";

    public SessionLifecycleController(ConnectionManager connectionManager, SessionDirectory directory,
                                      SessionMode initialMode) {
        this.connectionManager = connectionManager;
        this.directory = directory != null ? directory : SessionDirectory.local();
        this.mode = initialMode != null ? initialMode : SessionMode.ASK;
    }

    public synchronized Connection connect() {
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = UUID.randomUUID().toString();
        }
        boolean forceNew = needsRestart();
        ConnectionParams params = new ConnectionParams(sessionId, mode, forceNew, resumeNext, options, files);
        resumed = resumeNext;
        resumeNext = false;
        hardRestartPending = false;
        if (forceNew) {
            log.info("Options or attachments changed for session {}, requesting a fresh process", sessionId);
        }
        return connectionManager.open(params);
    }

    /** Reuses the current connection unless it is closed or a restart is due. */
    public synchronized Connection ensureConnected() {
        Optional<Connection> current = connectionManager.current();
        if (current.isPresent() && current.get().state() != ConnectionState.CLOSED && !needsRestart()) {
            return current.get();
        }
        return connect();
    }

    /** Hard restart: fresh remote process, same session id. A resumed session is resumed again. */
    public synchronized Connection restart() {
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = UUID.randomUUID().toString();
        }
        log.info("Restarting session {} in mode {} (resume={})", sessionId, mode.wireName(), resumed);
        hardRestartPending = false;
        return connectionManager.open(new ConnectionParams(sessionId, mode, true, resumed, options, files));
    }

    /**
     * Sends the new mode live when connected. Unless the remote side advertised live mode
     * switching, the session is then restarted with the mode in its connection parameters.
     *
     * @return false when the mode did not change
     */
    public synchronized boolean changeMode(SessionMode newMode) {
        if (newMode == null || newMode == mode) return false;
        mode = newMode;
        if (connectionManager.isConnected()) {
            connectionManager.sendControl("set_permission_mode", Map.of("mode", newMode.controlName()));
            if (liveModeSwitch) return true;
        }
        if (connectionManager.current().isPresent()) {
            restart();
        } else {
            hardRestartPending = true;
        }
        return true;
    }

    public synchronized void changeOptions(SessionOptions newOptions) {
        options = newOptions != null ? newOptions : SessionOptions.defaults();
    }

    public synchronized void attachFiles(List<FileReference> newFiles) {
        files = newFiles == null ? List.of() : newFiles.stream().filter(FileReference::isComplete).toList();
    }

    public synchronized void setModel(String model) {
        applyLive(options.withModel(model));
        connectionManager.sendControl("set_model", Map.of("model", model != null ? model : ""));
    }

    public synchronized void setMaxThinkingTokens(int tokens) {
        applyLive(options.withMaxThinkingTokens(tokens));
        connectionManager.sendControl("set_max_thinking_tokens", Map.of("max_thinking_tokens", tokens));
    }

    public synchronized Connection switchSession(String id, boolean resume) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("session id is required");
        }
        sessionId = id;
        resumeNext = resume;
        return connect();
    }

    public synchronized Connection newSession() {
        sessionId = directory.createSession().orElseGet(() -> UUID.randomUUID().toString());
        resumeNext = false;
        log.info("Starting new session {}", sessionId);
        return connect();
    }

    /** Records what the now-open connection was opened with. */
    public synchronized void onOpened(Connection connection) {
        openedOptionsKey = connection.params().options().restartKey();
        openedFilesKey = filesKey(connection.params().files());
    }

    public synchronized void onSessionIdAssigned(String id) {
        if (id != null && !id.isBlank()) sessionId = id;
    }

    /** The remote side lost the session; its replacement has nothing to resume. */
    public synchronized void onSessionReplaced(String id) {
        onSessionIdAssigned(id);
        resumed = false;
    }

    public synchronized void onSettingsSync(SessionSettings settings) {
        if (settings.model() != null) applyLive(options.withModel(settings.model()));
        if (settings.maxThinkingTokens() != null) applyLive(options.withMaxThinkingTokens(settings.maxThinkingTokens()));
        if (settings.liveModeSwitch() != null) liveModeSwitch = settings.liveModeSwitch();
        if (settings.mode() != null) mode = settings.mode();
    }

    public synchronized boolean needsRestart() {
        boolean optionsChanged = openedOptionsKey != null && !openedOptionsKey.equals(options.restartKey());
        String key = filesKey(files);
        boolean filesChanged = !key.isEmpty() && !key.equals(openedFilesKey);
        return hardRestartPending || optionsChanged || filesChanged;
    }

    public void close() {
        connectionManager.closeCurrent();
    }

    public synchronized String sessionId() { return sessionId; }
    public synchronized SessionMode mode() { return mode; }
    public synchronized SessionOptions options() { return options; }
    public synchronized List<FileReference> files() { return files; }

    /** Options applied live keep the opened baseline in step, so they never force a restart by themselves. */
    private void applyLive(SessionOptions updated) {
        boolean baselineInStep = openedOptionsKey != null && openedOptionsKey.equals(options.restartKey());
        options = updated;
        if (baselineInStep) openedOptionsKey = updated.restartKey();
    }

    private static String filesKey(List<FileReference> refs) {
        return refs.stream().map(FileReference::toSpec).collect(Collectors.joining("|"));
    }
}

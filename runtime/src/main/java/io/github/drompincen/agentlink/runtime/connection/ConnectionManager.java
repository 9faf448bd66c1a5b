package io.github.drompincen.agentlink.runtime.connection;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentlink.protocol.api.CloseCodes;
import io.github.drompincen.agentlink.protocol.api.ConnectionParams;
import io.github.drompincen.agentlink.protocol.api.ErrorNotice;
import io.github.drompincen.agentlink.protocol.api.SessionSettings;
import io.github.drompincen.agentlink.protocol.api.TransportTarget;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import io.github.drompincen.agentlink.protocol.frame.FrameCodec;
import io.github.drompincen.agentlink.protocol.frame.FrameType;
import io.github.drompincen.agentlink.protocol.frame.Frames;
import io.github.drompincen.agentlink.runtime.config.StreamTimings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the live connection of one session: opening, closing, sending, the reconnect policy and
 * the connection-level system frames. A monotonically increasing generation identifies the
 * current connection; callbacks and scheduled work belonging to an older generation are ignored.
 */
public class ConnectionManager implements FrameSender {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final String endpoint;
    private final TransportFactory transportFactory;
    private final FrameCodec codec;
    private final ScheduledExecutorService scheduler;
    private final StreamTimings timings;
    private final ConnectionEvents events;
    private final AtomicLong generation = new AtomicLong();
    private volatile Connection current;

    public ConnectionManager(String endpoint, TransportFactory transportFactory, FrameCodec codec,
                             ScheduledExecutorService scheduler, StreamTimings timings,
                             ConnectionEvents events) {
        this.endpoint = endpoint;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.scheduler = scheduler;
        this.timings = timings;
        this.events = events;
    }

    /**
     * Opens a new connection, superseding (and closing) the current one.
     */
    public synchronized Connection open(ConnectionParams params) {
        Connection previous = current;
        Connection connection = new Connection(generation.incrementAndGet(), params);
        current = connection;
        if (previous != null) {
            shutdown(previous, "superseded");
        }

        URI target = TransportTarget.build(endpoint, params);
        log.info("Connecting session {} (gen {}) to {}", params.sessionId(), connection.generation(), target);
        events.onConnectionOpening(connection);
        Listener listener = new Listener(connection);
        try {
            if (connection.attach(transportFactory.open(target, listener))) {
                // opened before the factory returned; finish outside this monitor
                scheduler.execute(listener::handshake);
            }
        } catch (RuntimeException e) {
            log.error("Failed to open transport to {}", target, e);
            connection.markClosed("open failed");
            if (isCurrent(connection)) {
                events.onError(ErrorNotice.connection("Unable to reach the agent backend: " + e.getMessage()));
            }
        }
        return connection;
    }

    /** Closes intentionally. A closed connection is never reconnected. */
    public synchronized void close(Connection connection) {
        if (connection == null) return;
        if (current == connection) {
            generation.incrementAndGet();
            current = null;
        }
        shutdown(connection, "closed by client");
    }

    public void closeCurrent() {
        close(current);
    }

    public Optional<Connection> current() {
        return Optional.ofNullable(current);
    }

    public boolean isConnected() {
        Connection c = current;
        return c != null && c.isOpen();
    }

    /** Sends on the current connection. */
    @Override
    public boolean send(Frame frame) {
        return send(current, frame);
    }

    /** Drops the frame with a warning unless {@code connection} is the current, open connection. */
    public boolean send(Connection connection, Frame frame) {
        if (trySend(connection, frame)) return true;
        log.warn("Dropping outbound {} frame: connection not open", frame.type().wireName());
        return false;
    }

    /**
     * Sends a {@code control} frame, retrying while no connection is open.
     */
    public void sendControl(String subtype, Map<String, ?> fields) {
        sendControl(Frames.control(subtype, fields), 0);
    }

    private void sendControl(Frame frame, int attempt) {
        if (trySend(current, frame)) return;
        if (attempt < timings.controlRetryAttempts()) {
            scheduler.schedule(() -> sendControl(frame, attempt + 1),
                    timings.controlRetryInterval().toMillis(), TimeUnit.MILLISECONDS);
        } else {
            log.warn("Control message {} dropped: connection not established after {} attempts",
                    frame.subtype(), attempt);
        }
    }

    private boolean trySend(Connection connection, Frame frame) {
        if (connection == null || connection != current || !connection.isOpen()) return false;
        try {
            connection.transport().send(codec.encode(frame));
            log.debug(">> {} {}", frame.type().wireName(), frame.subtype() != null ? frame.subtype() : "");
            return true;
        } catch (IOException e) {
            log.warn("Failed to send {} frame on {}: {}", frame.type().wireName(), connection, e.getMessage());
            return false;
        }
    }

    private boolean isCurrent(Connection connection) {
        return current == connection && generation.get() == connection.generation();
    }

    private void shutdown(Connection connection, String reason) {
        connection.markClosed(reason);
        Transport transport = connection.transport();
        if (transport != null && transport.isOpen()) {
            transport.close(CloseCodes.NORMAL, reason);
        }
    }

    private void handleFrame(Connection connection, Frame frame) {
        if (frame.type() == FrameType.SYSTEM && frame.subtype() != null) {
            switch (frame.subtype()) {
                case "connected" -> onConnectedFrame(connection, frame);
                case "error" -> events.onError(ErrorNotice.session(
                        Optional.ofNullable(frame.text("message")).orElse("The agent reported an error.")));
                case "init" -> onInitFrame(frame);
                case "session_not_found" -> {
                    onSessionNotFound(connection);
                    return;
                }
                default -> { }
            }
        }
        connection.queue().push(frame);
    }

    private void onConnectedFrame(Connection connection, Frame frame) {
        String sessionId = frame.text("session_id");
        if (sessionId != null && !sessionId.isBlank()) {
            connection.assignSessionId(sessionId);
            log.info("Session {} connected (resumed={})", sessionId, frame.get("resumed").asBoolean(false));
            events.onSessionIdAssigned(sessionId);
        }
        JsonNode settings = frame.get("settings");
        if (settings.isObject()) {
            events.onSettings(new SessionSettings(
                    settings.hasNonNull("model") ? settings.get("model").asText() : null,
                    settings.hasNonNull("max_thinking_tokens") ? settings.get("max_thinking_tokens").asInt() : null,
                    null,
                    settings.hasNonNull("live_mode_switch") ? settings.get("live_mode_switch").asBoolean() : null));
        }
    }

    private void onInitFrame(Frame frame) {
        JsonNode commands = frame.get("slash_commands");
        if (!commands.isArray()) return;
        List<String> names = new ArrayList<>();
        commands.forEach(c -> names.add(c.asText()));
        events.onSlashCommands(names);
    }

    private void onSessionNotFound(Connection connection) {
        String oldId = connection.sessionId();
        String newId = UUID.randomUUID().toString();
        log.info("Session {} not found remotely, starting new session {}", oldId, newId);
        ConnectionParams next = connection.params().withSessionId(newId).withResume(false).withForceNew(false);
        long expected;
        synchronized (this) {
            if (!isCurrent(connection)) return;
            close(connection);
            expected = generation.get();
        }
        events.onSessionReplaced(oldId, newId);
        scheduler.schedule(() -> {
            synchronized (this) {
                if (generation.get() != expected) {
                    log.debug("Skipping replacement connect for {}: superseded", newId);
                    return;
                }
                open(next);
            }
        }, timings.sessionNotFoundDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void scheduleReconnect(Connection dropped) {
        long droppedGeneration = dropped.generation();
        ConnectionParams next = dropped.params()
                .withSessionId(dropped.sessionId())
                .withForceNew(false)
                .withResume(false);
        log.info("Connection lost for session {}, reconnecting in {} ms",
                dropped.sessionId(), timings.reconnectDelay().toMillis());
        scheduler.schedule(() -> {
            synchronized (this) {
                if (generation.get() != droppedGeneration) {
                    log.debug("Skipping reconnect of gen {}: a newer connection exists", droppedGeneration);
                    return;
                }
                open(next);
            }
        }, timings.reconnectDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private class Listener implements TransportListener {

        private final Connection connection;

        Listener(Connection connection) {
            this.connection = connection;
        }

        @Override
        public void onOpen() {
            if (connection.transportOpened()) {
                handshake();
            }
        }

        void handshake() {
            if (!isCurrent(connection) || !connection.markOpen()) return;
            log.info("Connected {}", connection);
            send(connection, Frames.initialize());
            events.onConnected(connection);
            connection.completeOpen();
        }

        @Override
        public void onText(String text) {
            if (!isCurrent(connection)) return;
            Optional<Frame> frame = codec.decode(text);
            if (frame.isEmpty()) {
                log.warn("Dropping unparsable frame on {}", connection);
                return;
            }
            log.debug("<< {} {}", frame.get().type().wireName(),
                    frame.get().subtype() != null ? frame.get().subtype() : "");
            handleFrame(connection, frame.get());
        }

        @Override
        public void onClose(int code, String reason) {
            log.info("Connection {} closed: {} {}", connection, code, reason);
            boolean wasCurrent;
            synchronized (ConnectionManager.this) {
                wasCurrent = isCurrent(connection);
            }
            connection.markClosed(reason != null ? reason : String.valueOf(code));
            if (!wasCurrent) return;
            events.onDisconnected(connection, code);
            if (code == CloseCodes.ABNORMAL) {
                scheduleReconnect(connection);
            }
        }

        @Override
        public void onError(Throwable error) {
            log.error("Transport error on {}", connection, error);
            if (!isCurrent(connection)) return;
            events.onError(ErrorNotice.connection("Unable to reach the agent backend."));
        }
    }
}

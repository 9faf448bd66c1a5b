package io.github.drompincen.agentlink.gateway.session;

import io.github.drompincen.agentlink.protocol.api.CreateSessionRequest;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.runtime.session.AgentSession;
import io.github.drompincen.agentlink.runtime.session.AgentSessionFactory;
import io.github.drompincen.agentlink.runtime.session.SessionListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live agent sessions of this gateway. A session stays reachable under every id it has had,
 * since the remote side may confirm or replace the id it was opened with.
 */
@Service
public class AgentSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionRegistry.class);

    private final AgentSessionFactory factory;
    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    public AgentSessionRegistry(AgentSessionFactory factory) {
        this.factory = factory;
    }

    public AgentSession create(CreateSessionRequest req) {
        SessionMode mode = req.mode() != null && !req.mode().isBlank() ? SessionMode.fromWire(req.mode()) : null;
        AgentSession session = factory.create(mode);
        if (req.options() != null) session.changeOptions(req.options());
        if (req.files() != null) session.attachFiles(req.files());
        session.addListener(new SessionListener() {
            @Override
            public void onSessionIdAssigned(String sessionId) {
                sessions.put(sessionId, session);
            }
        });
        if (req.sessionId() != null && !req.sessionId().isBlank()) {
            session.switchSession(req.sessionId(), Boolean.TRUE.equals(req.resume()));
        } else {
            session.connect();
        }
        sessions.put(session.sessionId(), session);
        log.info("Registered agent session {}", session.sessionId());
        return session;
    }

    public Optional<AgentSession> find(String sessionId) {
        return Optional.ofNullable(sessionId != null ? sessions.get(sessionId) : null);
    }

    /** Each session once, in no particular order. */
    public Collection<AgentSession> all() {
        return new LinkedHashSet<>(sessions.values());
    }

    public boolean close(String sessionId) {
        AgentSession session = sessions.get(sessionId);
        if (session == null) return false;
        sessions.values().removeIf(s -> s == session);
        session.close();
        log.info("Closed agent session {}", sessionId);
        return true;
    }

    @PreDestroy
    public void closeAll() {
        all().forEach(AgentSession::close);
        sessions.clear();
    }
}

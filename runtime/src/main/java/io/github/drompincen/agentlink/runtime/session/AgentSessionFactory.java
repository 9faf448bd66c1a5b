package io.github.drompincen.agentlink.runtime.session;

import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.frame.FrameCodec;
import io.github.drompincen.agentlink.runtime.config.ClientSettings;
import io.github.drompincen.agentlink.runtime.connection.TransportFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;

@Component
public class AgentSessionFactory {

    private final ClientSettings settings;
    private final TransportFactory transportFactory;
    private final FrameCodec codec;
    private final ScheduledExecutorService scheduler;
    private final SessionDirectory directory;

    public AgentSessionFactory(ClientSettings settings, TransportFactory transportFactory, FrameCodec codec,
                               ScheduledExecutorService scheduler, SessionDirectory directory) {
        this.settings = settings;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.scheduler = scheduler;
        this.directory = directory;
    }

    public AgentSession create() {
        return create(null);
    }

    /** @param initialMode mode of the first connection; null for the configured default */
    public AgentSession create(SessionMode initialMode) {
        return new AgentSession(settings, transportFactory, codec, scheduler, directory, initialMode);
    }
}

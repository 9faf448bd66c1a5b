package io.github.drompincen.agentlink.gateway.config;

import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.runtime.config.ClientSettings;
import io.github.drompincen.agentlink.runtime.config.StreamTimings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "agentlink")
public class AgentLinkProperties {

    /** Base WebSocket endpoint of the agent backend. */
    private String endpoint = "ws://localhost:8765/ws/claude-stream";

    /** HTTP base of the agent backend, used to allocate new sessions. */
    private String apiBase = "http://localhost:8765";

    /** {@code ask}, {@code act} or {@code plan}. */
    private String defaultMode = "ask";

    private int schedulerPoolSize = 2;

    private Timings timings = new Timings();

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getApiBase() { return apiBase; }
    public void setApiBase(String apiBase) { this.apiBase = apiBase; }
    public String getDefaultMode() { return defaultMode; }
    public void setDefaultMode(String defaultMode) { this.defaultMode = defaultMode; }
    public int getSchedulerPoolSize() { return schedulerPoolSize; }
    public void setSchedulerPoolSize(int schedulerPoolSize) { this.schedulerPoolSize = schedulerPoolSize; }
    public Timings getTimings() { return timings; }
    public void setTimings(Timings timings) { this.timings = timings; }

    public ClientSettings toClientSettings() {
        return new ClientSettings(endpoint, SessionMode.fromWire(defaultMode), timings.toStreamTimings());
    }

    public static class Timings {
        private Duration reconnectDelay = Duration.ofMillis(1000);
        private Duration sessionNotFoundDelay = Duration.ofMillis(100);
        private Duration pendingToRunning = Duration.ofMillis(120);
        private Duration streamingToComplete = Duration.ofMillis(160);
        private Duration approvedToComplete = Duration.ofMillis(180);
        private Duration controlRetryInterval = Duration.ofMillis(500);
        private int controlRetryAttempts = 10;

        public Duration getReconnectDelay() { return reconnectDelay; }
        public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }
        public Duration getSessionNotFoundDelay() { return sessionNotFoundDelay; }
        public void setSessionNotFoundDelay(Duration sessionNotFoundDelay) { this.sessionNotFoundDelay = sessionNotFoundDelay; }
        public Duration getPendingToRunning() { return pendingToRunning; }
        public void setPendingToRunning(Duration pendingToRunning) { this.pendingToRunning = pendingToRunning; }
        public Duration getStreamingToComplete() { return streamingToComplete; }
        public void setStreamingToComplete(Duration streamingToComplete) { this.streamingToComplete = streamingToComplete; }
        public Duration getApprovedToComplete() { return approvedToComplete; }
        public void setApprovedToComplete(Duration approvedToComplete) { this.approvedToComplete = approvedToComplete; }
        public Duration getControlRetryInterval() { return controlRetryInterval; }
        public void setControlRetryInterval(Duration controlRetryInterval) { this.controlRetryInterval = controlRetryInterval; }
        public int getControlRetryAttempts() { return controlRetryAttempts; }
        public void setControlRetryAttempts(int controlRetryAttempts) { this.controlRetryAttempts = controlRetryAttempts; }

        StreamTimings toStreamTimings() {
            return new StreamTimings(reconnectDelay, sessionNotFoundDelay, pendingToRunning, streamingToComplete,
                    approvedToComplete, controlRetryInterval, controlRetryAttempts);
        }
    }
}

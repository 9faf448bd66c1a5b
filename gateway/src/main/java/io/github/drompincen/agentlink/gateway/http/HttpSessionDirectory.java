package io.github.drompincen.agentlink.gateway.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentlink.gateway.config.AgentLinkProperties;
import io.github.drompincen.agentlink.runtime.session.SessionDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Allocates session ids through the backend's {@code POST /api/sessions}. Any failure yields
 * empty so the caller falls back to a locally minted id.
 */
@Component
public class HttpSessionDirectory implements SessionDirectory {

    private static final Logger log = LoggerFactory.getLogger(HttpSessionDirectory.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    @Autowired
    public HttpSessionDirectory(AgentLinkProperties properties, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), objectMapper,
                properties.getApiBase());
    }

    HttpSessionDirectory(HttpClient httpClient, ObjectMapper objectMapper, String apiBase) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
    }

    @Override
    public Optional<String> createSession() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/api/sessions"))
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("Session creation failed with status {}", response.statusCode());
                return Optional.empty();
            }
            JsonNode body = objectMapper.readTree(response.body());
            String id = body.hasNonNull("session_id") ? body.get("session_id").asText()
                    : body.hasNonNull("id") ? body.get("id").asText() : null;
            return Optional.ofNullable(id).filter(s -> !s.isBlank());
        } catch (IOException e) {
            log.warn("Session creation failed: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}

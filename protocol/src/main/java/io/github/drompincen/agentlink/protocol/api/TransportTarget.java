package io.github.drompincen.agentlink.protocol.api;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the connection URI from the base endpoint and the connection parameters.
 */
public final class TransportTarget {

    private TransportTarget() {}

    public static URI build(String endpoint, ConnectionParams params) {
        List<String> query = new ArrayList<>();
        add(query, "session_id", params.sessionId());
        if (params.mode() != null) add(query, "mode", params.mode().wireName());
        if (params.forceNew()) add(query, "force_new", "1");
        if (params.resume()) add(query, "resume", "1");

        SessionOptions options = params.options();
        add(query, "model", options.model());
        add(query, "max_thinking_tokens", options.maxThinkingTokens());
        add(query, "max_turns", options.maxTurns());
        add(query, "max_budget_usd", options.maxBudgetUsd());
        add(query, "allowed_tools", options.allowedTools());
        add(query, "disallowed_tools", options.disallowedTools());
        for (FileReference file : params.files()) {
            if (file.isComplete()) add(query, "file", file.toSpec());
        }

        String base = endpoint.endsWith("?") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return URI.create(query.isEmpty() ? base : base + "?" + String.join("&", query));
    }

    private static void add(List<String> query, String name, Object value) {
        if (value == null) return;
        String text = value.toString().trim();
        if (text.isEmpty()) return;
        query.add(name + "=" + URLEncoder.encode(text, StandardCharsets.UTF_8));
    }
}

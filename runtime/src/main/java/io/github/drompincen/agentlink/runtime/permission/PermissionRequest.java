package io.github.drompincen.agentlink.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.PermissionSource;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.PermissionState;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.Question;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * A pending or answered approval prompt. The source decides how the answer is framed.
 */
public class PermissionRequest {

    private final String requestId;
    private final String toolName;
    private final JsonNode toolInput;
    private final JsonNode permissionSuggestions;
    private final String blockedPath;
    private final PermissionSource source;
    private final List<Question> questions;
    private final Map<Integer, String> answers = new LinkedHashMap<>();
    private final Instant createdAt = Instant.now();
    private PermissionState state = PermissionState.PENDING;
    private String linkedToolId;

    public PermissionRequest(String requestId, String toolName, JsonNode toolInput,
                             JsonNode permissionSuggestions, String blockedPath,
                             PermissionSource source, List<Question> questions) {
        this.requestId = requestId;
        this.toolName = toolName;
        this.toolInput = toolInput;
        this.permissionSuggestions = permissionSuggestions;
        this.blockedPath = blockedPath;
        this.source = source;
        this.questions = questions != null ? List.copyOf(questions) : List.of();
    }

    static boolean isPlanExit(String toolName) {
        return toolName != null && toolName.replace("_", "").equalsIgnoreCase("exitplanmode");
    }

    public String getRequestId() { return requestId; }
    public String getToolName() { return toolName; }
    public JsonNode getToolInput() { return toolInput; }
    public JsonNode getPermissionSuggestions() { return permissionSuggestions; }
    public String getBlockedPath() { return blockedPath; }
    public PermissionSource getSource() { return source; }
    public List<Question> getQuestions() { return questions; }
    /** Answers by question index. */
    public Map<Integer, String> getAnswers() { return answers; }
    public PermissionState getState() { return state; }
    public String getLinkedToolId() { return linkedToolId; }

    public boolean isPending() {
        return state == PermissionState.PENDING;
    }

    public boolean isPlanExit() {
        return isPlanExit(toolName);
    }

    void setState(PermissionState state) {
        this.state = state;
    }

    void setLinkedToolId(String linkedToolId) {
        this.linkedToolId = linkedToolId;
    }

    /** True when every question has a non-blank answer. */
    boolean isFullyAnswered() {
        if (questions.isEmpty()) return false;
        for (int i = 0; i < questions.size(); i++) {
            String answer = answers.get(i);
            if (answer == null || answer.isBlank()) return false;
        }
        return true;
    }

    /**
     * Index of the question a key refers to: the index itself, or the question text. Repeated
     * texts resolve to the first of them still unanswered.
     */
    OptionalInt questionIndex(String key) {
        if (key == null) return OptionalInt.empty();
        String trimmed = key.trim();
        if (trimmed.matches("\\d{1,9}")) {
            int index = Integer.parseInt(trimmed);
            if (index < questions.size()) return OptionalInt.of(index);
        }
        int firstMatch = -1;
        for (int i = 0; i < questions.size(); i++) {
            if (!questions.get(i).question().equals(key)) continue;
            if (!answers.containsKey(i)) return OptionalInt.of(i);
            if (firstMatch < 0) firstMatch = i;
        }
        return firstMatch >= 0 ? OptionalInt.of(firstMatch) : OptionalInt.empty();
    }

    public PermissionRequestDto toDto() {
        return new PermissionRequestDto(requestId, toolName, toolInput, permissionSuggestions, blockedPath,
                source, state, questions, createdAt);
    }
}

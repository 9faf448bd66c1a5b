package io.github.drompincen.agentlink.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.agentlink.protocol.api.ApprovalScope;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.PermissionSource;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.PermissionState;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto.Question;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import io.github.drompincen.agentlink.protocol.frame.Frames;
import io.github.drompincen.agentlink.runtime.connection.FrameSender;
import io.github.drompincen.agentlink.runtime.conversation.ConversationReconstructor;
import io.github.drompincen.agentlink.runtime.conversation.ToolCallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control-request / control-response exchange that gates tool execution.
 * A request is PENDING until it is allowed, denied, dismissed or cancelled; every answer is terminal.
 */
public class PermissionHandshake {

    private static final Logger log = LoggerFactory.getLogger(PermissionHandshake.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final String QUESTION_TOOL = "AskUserQuestion";

    private final Map<String, PermissionRequest> requests = new LinkedHashMap<>();
    private final FrameSender sender;
    private final ConversationReconstructor reconstructor;

    public PermissionHandshake(FrameSender sender, ConversationReconstructor reconstructor) {
        this.sender = sender;
        this.reconstructor = reconstructor;
    }

    /**
     * Native prompt. The tool call it gates is announced to the turn (same dedup rules as
     * assistant announcements) and linked to the request when newly created.
     */
    public synchronized PermissionRequest onControlRequest(Frame frame) {
        JsonNode request = frame.get("request");
        String requestId = Optional.ofNullable(frame.requestId()).orElseGet(() -> "control-" + System.currentTimeMillis());
        String toolName = firstText(request, "tool_name", "toolName").orElse("tool");
        JsonNode toolInput = firstObject(request, "input", "tool_input", "inputs");
        JsonNode suggestions = first(request, "permission_suggestions", "suggestions")
                .filter(JsonNode::isArray)
                .orElseGet(NODES::arrayNode);
        String blockedPath = firstText(request, "blocked_path", "blockedPath").orElse(null);

        PermissionRequest permission = new PermissionRequest(requestId, toolName, toolInput, suggestions,
                blockedPath, PermissionSource.CONTROL_REQUEST, null);
        String toolId = firstText(request, "tool_use_id").orElse(requestId);
        reconstructor.announceGatedTool(toolId, toolName, toolInput)
                .ifPresent(record -> permission.setLinkedToolId(record.id()));
        return register(permission);
    }

    /** Prompts embedded in other frame kinds ({@code permission_request} and friends). */
    public synchronized PermissionRequest onStreamPermission(Frame frame) {
        JsonNode body = frame.body();
        String requestId = firstText(body, "id", "tool_use_id", "request_id")
                .orElseGet(() -> "stream-" + System.currentTimeMillis());
        String toolName = firstText(body, "tool_name", "tool", "name").orElse("tool");
        JsonNode toolInput = firstObject(body, "tool_input", "input");
        String blockedPath = firstText(body, "file_path", "path").orElse(null);
        return register(new PermissionRequest(requestId, toolName, toolInput, null, blockedPath,
                PermissionSource.STREAM, null));
    }

    public synchronized PermissionRequest onUserQuestion(Frame frame) {
        JsonNode body = frame.body();
        String requestId = firstText(body, "request_id", "id")
                .orElseGet(() -> "question-" + System.currentTimeMillis());
        JsonNode rawQuestions = first(body, "questions")
                .or(() -> Optional.of(body.path("request").path("questions")))
                .filter(JsonNode::isArray)
                .orElseGet(NODES::arrayNode);
        List<Question> questions = new ArrayList<>();
        rawQuestions.forEach(q -> questions.add(new Question(q.path("question").asText(""),
                q.path("multiSelect").asBoolean(false))));
        ObjectNode toolInput = NODES.objectNode();
        toolInput.set("questions", rawQuestions);
        toolInput.putObject("answers");
        return register(new PermissionRequest(requestId, QUESTION_TOOL, toolInput, null, null,
                PermissionSource.USER_QUESTION, questions));
    }

    /**
     * Denials reported in a result frame. Only the first one becomes a (dismiss-only) prompt.
     */
    public synchronized Optional<PermissionRequest> onDenials(Frame result) {
        JsonNode denials = result.get("permission_denials");
        if (!denials.isArray() || denials.isEmpty()) return Optional.empty();
        JsonNode denial = denials.get(0);
        String requestId = firstText(denial, "tool_use_id").orElseGet(() -> "denied-" + System.currentTimeMillis());
        String toolName = firstText(denial, "tool_name").orElse("tool");
        JsonNode toolInput = firstObject(denial, "tool_input");
        String blockedPath = firstText(denial, "blocked_path", "blockedPath").orElse(null);
        return Optional.of(register(new PermissionRequest(requestId, toolName, toolInput, null, blockedPath,
                PermissionSource.DENIAL, null)));
    }

    /**
     * Remote cancellation. The linked tool call fails; a missing request id cancels every
     * pending native prompt.
     */
    public synchronized List<PermissionRequest> onCancel(String requestId) {
        List<PermissionRequest> cancelled = new ArrayList<>();
        for (PermissionRequest request : requests.values()) {
            boolean matches = requestId == null
                    ? request.getSource() == PermissionSource.CONTROL_REQUEST
                    : request.getRequestId().equals(requestId);
            if (matches && request.isPending()) {
                request.setState(PermissionState.CANCELLED);
                failLinkedTool(request, DenialMessages.CANCELLED);
                cancelled.add(request);
            }
        }
        if (cancelled.isEmpty()) {
            log.debug("Cancel for unknown or settled request {}", requestId);
        }
        return cancelled;
    }

    /**
     * Allows the request. With a scope, the request's suggestions are sent along with every
     * non-{@code setMode} suggestion recorded against that scope's destination.
     */
    public synchronized PermissionRequest allow(String requestId, JsonNode updatedInput, ApprovalScope scope) {
        PermissionRequest request = requirePending(requestId);
        if (request.getSource() == PermissionSource.USER_QUESTION) {
            return submitAnswers(requestId);
        }
        JsonNode suggestions = scope != null ? applyDestination(request.getPermissionSuggestions(), scope) : null;
        return sendAllow(request, updatedInput, suggestions);
    }

    /**
     * Leaves plan mode. {@link SessionMode#ACT} auto-accepts edits; {@link SessionMode#ASK}
     * keeps manual approval by asking the remote side to switch to the default mode.
     *
     * @return the mode the session should continue in
     */
    public synchronized SessionMode allowPlanExit(String requestId, SessionMode nextMode) {
        PermissionRequest request = requirePending(requestId);
        if (!request.isPlanExit()) {
            throw new IllegalStateException("Request " + requestId + " is not a plan exit (" + request.getToolName() + ")");
        }
        SessionMode target = nextMode != null ? nextMode : SessionMode.ACT;
        JsonNode suggestions = null;
        if (target == SessionMode.ASK) {
            ArrayNode setMode = NODES.arrayNode();
            setMode.addObject()
                    .put("type", "setMode")
                    .put("mode", SessionMode.ASK.controlName())
                    .put("destination", ApprovalScope.SESSION.destination());
            suggestions = setMode;
        }
        sendAllow(request, null, suggestions);
        return target;
    }

    public synchronized PermissionRequest deny(String requestId, String reason) {
        PermissionRequest request = requirePending(requestId);
        if (request.getSource() == PermissionSource.USER_QUESTION) {
            send(Frames.answers(requestId, NODES.objectNode()));
            request.setState(PermissionState.DENIED);
            return request;
        }
        if (request.getSource() == PermissionSource.DENIAL) {
            throw new IllegalStateException("Request " + requestId + " can only be dismissed");
        }
        String message = DenialMessages.forDenial(request.getToolName(), reason);
        send(Frames.deny(requestId, request.getToolInput(), message));
        request.setState(PermissionState.DENIED);
        failLinkedTool(request, message);
        log.info("Denied {} for tool {}", requestId, request.getToolName());
        return request;
    }

    /** Local only: no frame is sent. */
    public synchronized PermissionRequest dismiss(String requestId) {
        PermissionRequest request = requirePending(requestId);
        request.setState(PermissionState.DISMISSED);
        return request;
    }

    /**
     * Records one answer of a question batch. {@code question} is the question's index or its
     * text. Nothing is sent until {@link #submitAnswers}.
     */
    public synchronized PermissionRequest answer(String requestId, String question, String answer) {
        PermissionRequest request = requirePending(requestId);
        if (request.getSource() != PermissionSource.USER_QUESTION) {
            throw new IllegalStateException("Request " + requestId + " is not a question batch");
        }
        int index = request.questionIndex(question)
                .orElseThrow(() -> new IllegalArgumentException("Unknown question: " + question));
        request.getAnswers().put(index, answer);
        return request;
    }

    public synchronized PermissionRequest submitAnswers(String requestId) {
        PermissionRequest request = requirePending(requestId);
        if (request.getSource() != PermissionSource.USER_QUESTION) {
            throw new IllegalStateException("Request " + requestId + " is not a question batch");
        }
        if (!request.isFullyAnswered()) {
            throw new IllegalStateException("Every question must be answered before submitting");
        }
        send(Frames.answers(requestId, buildAnswers(request)));
        request.setState(PermissionState.ALLOWED);
        return request;
    }

    /** Turn ended without denials: outstanding prompts are no longer actionable. */
    public synchronized void dismissOutstanding() {
        requests.values().stream()
                .filter(PermissionRequest::isPending)
                .filter(r -> r.getSource() != PermissionSource.DENIAL)
                .forEach(r -> r.setState(PermissionState.DISMISSED));
    }

    public synchronized Optional<PermissionRequest> find(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    public synchronized List<PermissionRequest> pending() {
        return requests.values().stream().filter(PermissionRequest::isPending).toList();
    }

    public synchronized void clear() {
        requests.clear();
    }

    static ObjectNode buildAnswers(PermissionRequest request) {
        ObjectNode answers = NODES.objectNode();
        List<Question> questions = request.getQuestions();
        for (int i = 0; i < questions.size(); i++) {
            Question question = questions.get(i);
            String answer = request.getAnswers().get(i);
            if (answer == null || answer.isBlank()) continue;
            if (question.multiSelect()) {
                ArrayNode parts = NODES.arrayNode();
                Arrays.stream(answer.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(parts::add);
                if (!parts.isEmpty()) answers.set(String.valueOf(i), parts);
            } else {
                answers.put(String.valueOf(i), answer);
            }
        }
        return answers;
    }

    static JsonNode applyDestination(JsonNode suggestions, ApprovalScope scope) {
        ArrayNode applied = NODES.arrayNode();
        if (suggestions == null || !suggestions.isArray()) return applied;
        for (JsonNode suggestion : suggestions) {
            if (suggestion.isObject() && !"setMode".equals(suggestion.path("type").asText())) {
                ObjectNode copy = ((ObjectNode) suggestion).deepCopy();
                copy.put("destination", scope.destination());
                applied.add(copy);
            } else {
                applied.add(suggestion);
            }
        }
        return applied;
    }

    private PermissionRequest sendAllow(PermissionRequest request, JsonNode updatedInput, JsonNode suggestions) {
        if (request.getSource() == PermissionSource.DENIAL) {
            throw new IllegalStateException("Request " + request.getRequestId() + " can only be dismissed");
        }
        send(Frames.allow(request.getRequestId(), request.getToolInput(), updatedInput, suggestions));
        request.setState(PermissionState.ALLOWED);
        if (request.getLinkedToolId() != null) {
            reconstructor.correlator().markApproved(request.getLinkedToolId());
        }
        log.info("Allowed {} for tool {}", request.getRequestId(), request.getToolName());
        return request;
    }

    private void send(Frame frame) {
        if (!sender.send(frame)) {
            throw new IllegalStateException("Not connected; the answer was not delivered");
        }
    }

    private void failLinkedTool(PermissionRequest request, String message) {
        if (request.getLinkedToolId() == null) return;
        reconstructor.correlator().find(request.getLinkedToolId())
                .filter(record -> !record.status().isTerminal())
                .map(ToolCallRecord::id)
                .ifPresent(id -> reconstructor.correlator().markError(id, message));
    }

    private PermissionRequest register(PermissionRequest request) {
        requests.put(request.getRequestId(), request);
        log.info("Permission request {} ({}) for tool {}", request.getRequestId(), request.getSource(),
                request.getToolName());
        return request;
    }

    private PermissionRequest requirePending(String requestId) {
        PermissionRequest request = requests.get(requestId);
        if (request == null) {
            throw new IllegalArgumentException("Unknown permission request: " + requestId);
        }
        if (!request.isPending()) {
            throw new IllegalStateException("Permission request " + requestId + " is already " + request.getState());
        }
        return request;
    }

    private static Optional<JsonNode> first(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) return Optional.of(value);
        }
        return Optional.empty();
    }

    private static Optional<String> firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isEmpty()) return Optional.of(value.asText());
        }
        return Optional.empty();
    }

    private static JsonNode firstObject(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isObject()) return value;
        }
        return NODES.objectNode();
    }
}

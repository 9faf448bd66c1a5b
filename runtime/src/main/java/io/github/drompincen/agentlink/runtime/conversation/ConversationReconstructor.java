package io.github.drompincen.agentlink.runtime.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentlink.protocol.api.ContentPartDto;
import io.github.drompincen.agentlink.protocol.api.TurnSnapshot;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the ordered content parts of the current turn from inbound frames, one frame at a time.
 * Must only be driven by the session's consumption loop (or while holding the session lock).
 */
public class ConversationReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ConversationReconstructor.class);

    private static final Pattern COMMAND_OUTPUT =
            Pattern.compile("<local-command-stdout>([\\s\\S]*?)</local-command-stdout>");

    private final ToolCallCorrelator correlator;
    private TurnState turn = new TurnState();
    private boolean active;

    public ConversationReconstructor(ToolCallCorrelator correlator) {
        this.correlator = correlator;
    }

    public ToolCallCorrelator correlator() {
        return correlator;
    }

    /** Starts a fresh turn; called when a user message is sent. */
    public void beginTurn() {
        correlator.reset();
        turn = new TurnState();
        active = true;
    }

    public boolean isTurnActive() {
        return active;
    }

    /** Ends the active turn without a result, e.g. when the connection is done. */
    public void endTurn() {
        active = false;
    }

    public void clear() {
        correlator.reset();
        turn = new TurnState();
        active = false;
    }

    public void onAssistant(Frame frame) {
        ensureTurn();
        JsonNode content = frame.messageContent();
        if (content.isTextual()) {
            turn.openText(content.asText());
            turn.markAssistantText();
            return;
        }
        if (!content.isArray()) return;
        for (JsonNode item : content) {
            switch (item.path("type").asText()) {
                case "thinking" -> {
                    String thinking = "<thinking>" + item.path("thinking").asText("") + "</thinking>\n\n";
                    TextPart cursor = turn.textCursor();
                    if (cursor == null) {
                        turn.openText(thinking);
                    } else {
                        cursor.prepend(thinking);
                    }
                    turn.markAssistantText();
                }
                case "text", "output_text" -> {
                    String text = item.path("text").asText("");
                    TextPart cursor = turn.textCursor();
                    if (cursor == null) {
                        turn.openText(text);
                    } else {
                        cursor.merge(text);
                    }
                    turn.markAssistantText();
                }
                case "tool_use" -> announceTool(item.path("id").asText(null), item.path("name").asText(null),
                        item.get("input"), true);
                default -> log.debug("Ignoring assistant content item of type {}", item.path("type").asText());
            }
        }
    }

    public void onUser(Frame frame) {
        if (!turn.markSeen(frame.uuid())) {
            log.debug("Skipping duplicate user frame {}", frame.uuid());
            return;
        }
        JsonNode content = frame.messageContent();
        if (content.isTextual()) {
            Matcher matcher = COMMAND_OUTPUT.matcher(content.asText());
            if (matcher.find()) {
                turn.recordCommandOutput(matcher.group(1).trim());
            }
            return;
        }
        if (!content.isArray()) return;
        for (JsonNode item : content) {
            if (!"tool_result".equals(item.path("type").asText())) continue;
            String toolUseId = item.path("tool_use_id").asText(null);
            JsonNode toolUseResult = frame.get("tool_use_result");
            List<String> pieces = new ArrayList<>();
            addIfPresent(pieces, ResultText.ofToolContent(item.get("content")));
            addIfPresent(pieces, toolUseResult.path("stdout").asText(""));
            addIfPresent(pieces, toolUseResult.path("stderr").asText(""));
            correlator.resolve(toolUseId, String.join("\n", pieces), item.path("is_error").asBoolean(false));
            return;
        }
    }

    /**
     * Ends the turn. Fallback text from the result is used only when no assistant text arrived;
     * captured local command output goes last.
     */
    public void onResult(Frame frame) {
        String finalText = ResultText.extract(frame.get("result"));
        if (!finalText.isEmpty() && !turn.hasAssistantText()) {
            turn.openText(finalText);
        }
        if (turn.latestCommandOutput() != null && !turn.latestCommandOutput().isEmpty()) {
            turn.openText(turn.latestCommandOutput());
        }
        correlator.settleStreaming();
        active = false;
    }

    /**
     * Announces a tool call that arrives as a permission prompt rather than as assistant content.
     * Such a call waits for the user and gets no advisory PENDING→RUNNING move.
     */
    public Optional<ToolCallRecord> announceGatedTool(String id, String name, JsonNode input) {
        return announceTool(id, name, input, false);
    }

    private Optional<ToolCallRecord> announceTool(String id, String name, JsonNode input, boolean advisoryRunning) {
        ensureTurn();
        Optional<ToolCallRecord> record = correlator.announce(id, name, input, advisoryRunning);
        record.ifPresent(turn::append);
        return record;
    }

    public TurnSnapshot snapshot(String sessionId) {
        List<ContentPartDto> parts = new ArrayList<>(turn.parts().size());
        for (TurnPart part : turn.parts()) {
            parts.add(part.toDto());
        }
        return new TurnSnapshot(sessionId, parts, !active);
    }

    private void ensureTurn() {
        if (!active) {
            log.debug("Content arrived outside a turn, starting one");
            beginTurn();
        }
    }

    private static void addIfPresent(List<String> pieces, String value) {
        if (value != null && !value.isEmpty()) pieces.add(value);
    }
}

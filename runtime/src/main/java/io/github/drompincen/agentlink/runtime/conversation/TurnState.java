package io.github.drompincen.agentlink.runtime.conversation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconstruction state of one turn, owned by the consumption loop.
 */
public class TurnState {

    private final List<TurnPart> parts = new ArrayList<>();
    private final Set<String> seenUuids = new HashSet<>();
    /** The text part new fragments merge into; null when the last part is not open text. */
    private TextPart textCursor;
    private boolean hasAssistantText;
    private String latestCommandOutput;

    public List<TurnPart> parts() {
        return parts;
    }

    public TextPart textCursor() {
        return textCursor;
    }

    public boolean hasAssistantText() {
        return hasAssistantText;
    }

    public String latestCommandOutput() {
        return latestCommandOutput;
    }

    /** Appends a new text part and moves the cursor to it. */
    public TextPart openText(String text) {
        TextPart part = new TextPart(text);
        parts.add(part);
        textCursor = part;
        return part;
    }

    /** Appends a non-text part; the next text fragment opens a new text part. */
    public void append(TurnPart part) {
        parts.add(part);
        textCursor = null;
    }

    public void markAssistantText() {
        hasAssistantText = true;
    }

    public void recordCommandOutput(String output) {
        latestCommandOutput = output;
    }

    /** @return false when the uuid was already seen */
    public boolean markSeen(String uuid) {
        return uuid == null || uuid.isEmpty() || seenUuids.add(uuid);
    }
}

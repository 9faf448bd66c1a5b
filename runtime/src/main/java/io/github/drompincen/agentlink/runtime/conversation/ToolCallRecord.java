package io.github.drompincen.agentlink.runtime.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentlink.protocol.api.ContentPartDto;
import io.github.drompincen.agentlink.protocol.api.ToolStatus;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One tool invocation of the current turn. Status changes from real frames go through
 * {@link #moveTo}; scheduled advisory transitions go through {@link #compareAndSet} so they
 * never override a status that already moved on.
 */
public class ToolCallRecord implements TurnPart {

    private final String id;
    private final String name;
    private final JsonNode input;
    private final String signature;
    private final AtomicReference<ToolStatus> status = new AtomicReference<>(ToolStatus.PENDING);
    private volatile String output = "";
    private volatile String error;
    private volatile Integer lineCount;
    private ScheduledFuture<?> pendingTransition;

    public ToolCallRecord(String id, String name, JsonNode input, String signature) {
        this.id = id;
        this.name = name;
        this.input = input;
        this.signature = signature;
    }

    public String id() { return id; }
    public String name() { return name; }
    public JsonNode input() { return input; }
    public String signature() { return signature; }
    public ToolStatus status() { return status.get(); }
    public String output() { return output; }
    public String error() { return error; }
    public Integer lineCount() { return lineCount; }

    public boolean compareAndSet(ToolStatus expected, ToolStatus next) {
        return status.compareAndSet(expected, next);
    }

    /** Applies a real status signal, cancelling any scheduled transition still waiting. */
    public synchronized void moveTo(ToolStatus next) {
        cancelPendingTransition();
        status.set(next);
    }

    synchronized void schedule(ScheduledFuture<?> transition) {
        cancelPendingTransition();
        this.pendingTransition = transition;
    }

    synchronized void cancelPendingTransition() {
        if (pendingTransition != null) {
            pendingTransition.cancel(false);
            pendingTransition = null;
        }
    }

    void appendOutput(String text) {
        output = TextMerge.merge(output, text);
    }

    void replaceOutputWithLineCount(int lines) {
        output = "";
        lineCount = lines;
    }

    void fail(String message) {
        error = message;
        moveTo(ToolStatus.ERROR);
    }

    boolean isReadTool() {
        return "read".equalsIgnoreCase(name);
    }

    @Override
    public ContentPartDto toDto() {
        return new ContentPartDto(ContentPartDto.PartKind.TOOL_USE, null, id, name, input,
                output, status.get(), error, lineCount);
    }
}

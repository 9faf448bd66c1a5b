package io.github.drompincen.agentlink.runtime.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentlink.protocol.api.ToolStatus;
import io.github.drompincen.agentlink.runtime.config.StreamTimings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tracks the tool invocations of the current turn: one owning map from identity to record plus
 * a signature index, updated together. The same logical call announced twice (by id or by
 * signature) yields one record.
 */
public class ToolCallCorrelator {

    private static final Logger log = LoggerFactory.getLogger(ToolCallCorrelator.class);

    private static final List<String> SALIENT_FIELDS = List.of("file_path", "path", "command");

    private final Map<String, ToolCallRecord> byId = new LinkedHashMap<>();
    private final Map<String, String> idBySignature = new HashMap<>();
    private final ScheduledExecutorService scheduler;
    private final StreamTimings timings;
    private final Runnable onChange;

    public ToolCallCorrelator(ScheduledExecutorService scheduler, StreamTimings timings, Runnable onChange) {
        this.scheduler = scheduler;
        this.timings = timings;
        this.onChange = onChange != null ? onChange : () -> {};
    }

    /** {@code name-<file_path|path|command|id>}. */
    public static String signature(String name, JsonNode input, String id) {
        String key = id;
        if (input != null) {
            for (String field : SALIENT_FIELDS) {
                JsonNode value = input.get(field);
                if (value != null && !value.isNull() && !value.asText().isEmpty()) {
                    key = value.asText();
                    break;
                }
            }
        }
        return name + "-" + key;
    }

    /**
     * Creates a PENDING record, or returns empty when the id or the signature was already seen.
     */
    public Optional<ToolCallRecord> announce(String id, String name, JsonNode input) {
        return announce(id, name, input, true);
    }

    /**
     * @param advisoryRunning false for a call gated on an approval: it stays PENDING until
     *                        {@link #markApproved} or a result moves it
     */
    public synchronized Optional<ToolCallRecord> announce(String id, String name, JsonNode input,
                                                          boolean advisoryRunning) {
        if (id == null || byId.containsKey(id)) {
            log.debug("Ignoring duplicate tool announcement {}", id);
            return Optional.empty();
        }
        String signature = signature(name, input, id);
        if (idBySignature.containsKey(signature)) {
            log.debug("Ignoring tool {} with already-seen signature {}", id, signature);
            return Optional.empty();
        }
        ToolCallRecord record = new ToolCallRecord(id, name, input, signature);
        byId.put(id, record);
        idBySignature.put(signature, id);
        if (advisoryRunning) {
            scheduleTransition(record, ToolStatus.PENDING, ToolStatus.RUNNING, timings.pendingToRunning());
        }
        return Optional.of(record);
    }

    public synchronized Optional<ToolCallRecord> find(String id) {
        return Optional.ofNullable(id != null ? byId.get(id) : null);
    }

    /**
     * Applies a tool result. Unknown ids are ignored. Output of {@code Read} is reduced to its
     * line count.
     */
    public synchronized Optional<ToolCallRecord> resolve(String id, String text, boolean isError) {
        ToolCallRecord record = id != null ? byId.get(id) : null;
        if (record == null) {
            log.debug("No tool call matches result for {}", id);
            return Optional.empty();
        }
        if (record.isReadTool()) {
            record.replaceOutputWithLineCount(text == null || text.isEmpty() ? 0 : text.split("\n", -1).length);
        } else {
            record.appendOutput(text);
        }
        if (isError) {
            record.moveTo(ToolStatus.ERROR);
        } else {
            record.moveTo(ToolStatus.STREAMING);
            scheduleTransition(record, ToolStatus.STREAMING, ToolStatus.COMPLETE, timings.streamingToComplete());
        }
        return Optional.of(record);
    }

    /** An approval was granted for the call: RUNNING now, COMPLETE shortly after unless a result arrives. */
    public synchronized void markApproved(String id) {
        find(id).ifPresent(record -> {
            record.moveTo(ToolStatus.RUNNING);
            scheduleTransition(record, ToolStatus.RUNNING, ToolStatus.COMPLETE, timings.approvedToComplete());
        });
    }

    public synchronized void markError(String id, String message) {
        find(id).ifPresent(record -> record.fail(message));
    }

    /** Turn ended: anything still streaming is complete now. */
    public synchronized void settleStreaming() {
        for (ToolCallRecord record : byId.values()) {
            if (record.status() == ToolStatus.STREAMING) {
                record.moveTo(ToolStatus.COMPLETE);
            }
        }
    }

    public synchronized List<ToolCallRecord> records() {
        return new ArrayList<>(byId.values());
    }

    public synchronized int size() {
        return byId.size();
    }

    public synchronized void reset() {
        byId.values().forEach(ToolCallRecord::cancelPendingTransition);
        byId.clear();
        idBySignature.clear();
    }

    private void scheduleTransition(ToolCallRecord record, ToolStatus from, ToolStatus to, Duration delay) {
        record.schedule(scheduler.schedule(() -> {
            if (record.compareAndSet(from, to)) {
                log.debug("Tool {} {} -> {}", record.id(), from, to);
                onChange.run();
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}

package io.github.drompincen.agentlink.runtime.conversation;

/**
 * Merges an incoming text fragment into previously accumulated text. Works for both wire styles,
 * growing snapshots and true deltas, and is idempotent under repeated delivery.
 */
public final class TextMerge {

    private TextMerge() {}

    public static String merge(String previous, String incoming) {
        String prev = previous != null ? previous : "";
        String next = incoming != null ? incoming : "";
        if (prev.isEmpty()) return next;
        if (next.startsWith(prev)) return next;
        if (prev.startsWith(next)) return prev;
        return prev + next;
    }
}

package io.github.drompincen.agentlink.protocol.api;

import java.util.Arrays;
import java.util.Map;

/**
 * Degree of autonomy granted to the remote agent. The wire name goes on the connection query,
 * the control name is what {@code set_permission_mode} carries.
 */
public enum SessionMode {
    ASK("ask", "default"),
    ACT("act", "acceptEdits"),
    PLAN("plan", "plan");

    private static final Map<String, SessionMode> CONTROL_ALIASES = Map.of(
            "default", ASK,
            "acceptEdits", ACT,
            "plan", PLAN,
            "bypassPermissions", ACT,
            "dontAsk", ACT,
            "delegate", ASK);

    private final String wireName;
    private final String controlName;

    SessionMode(String wireName, String controlName) {
        this.wireName = wireName;
        this.controlName = controlName;
    }

    public String wireName() {
        return wireName;
    }

    public String controlName() {
        return controlName;
    }

    public static SessionMode fromWire(String name) {
        return Arrays.stream(values())
                .filter(m -> m.wireName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session mode: " + name));
    }

    /** Unknown control names fall back to {@link #ASK}. */
    public static SessionMode fromControl(String name) {
        if (name == null) return ASK;
        return CONTROL_ALIASES.getOrDefault(name, ASK);
    }
}

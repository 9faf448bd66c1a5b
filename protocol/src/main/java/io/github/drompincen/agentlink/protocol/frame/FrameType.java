package io.github.drompincen.agentlink.protocol.frame;

import java.util.Arrays;

public enum FrameType {
    // Remote -> Client
    SYSTEM("system"),
    ASSISTANT("assistant"),
    USER("user"),
    RESULT("result"),
    CONTROL_REQUEST("control_request"),
    CONTROL_CANCEL_REQUEST("control_cancel_request"),

    // Both directions
    CONTROL("control"),

    // Client -> Remote
    CONTROL_RESPONSE("control_response"),

    // Legacy permission prompts raised outside the control channel
    PERMISSION_REQUEST("permission_request"),
    APPROVAL_REQUEST("approval_request"),
    INPUT_REQUEST("input_request"),
    USER_INPUT_REQUEST("user_input_request"),

    UNKNOWN("unknown");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FrameType fromWire(String name) {
        if (name == null) return UNKNOWN;
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst()
                .orElse(UNKNOWN);
    }
}

package io.github.drompincen.agentlink.runtime.permission;

/**
 * Rejection texts sent with a {@code deny} decision. The remote agent reads them verbatim.
 */
public final class DenialMessages {

    public static final String DEFAULT =
            "The user doesn't want to proceed with this tool use. The tool use was rejected "
                    + "(eg. if it was a file edit, the new_string was NOT written to the file). "
                    + "STOP what you are doing and wait for the user to tell you how to proceed.";

    public static final String PLAN =
            "User chose to stay in plan mode and continue planning";

    public static final String REASON_PREFIX =
            "The user doesn't want to proceed with this tool use. The tool use was rejected "
                    + "(eg. if it was a file edit, the new_string was NOT written to the file). "
                    + "The user provided the following reason for the rejection: ";

    public static final String CANCELLED = "Permission request canceled";

    private DenialMessages() {}

    public static String forDenial(String toolName, String reason) {
        if (reason != null && !reason.isBlank()) {
            return REASON_PREFIX + reason.trim();
        }
        return PermissionRequest.isPlanExit(toolName) ? PLAN : DEFAULT;
    }
}

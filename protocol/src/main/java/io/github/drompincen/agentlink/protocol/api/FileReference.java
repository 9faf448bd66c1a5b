package io.github.drompincen.agentlink.protocol.api;

public record FileReference(
        String fileId,
        String relativePath
) {
    public boolean isComplete() {
        return fileId != null && !fileId.isBlank() && relativePath != null && !relativePath.isBlank();
    }

    /** {@code fileId:relativePath}, the form used by the {@code file} query parameter. */
    public String toSpec() {
        return fileId + ":" + relativePath;
    }
}

package io.github.drompincen.agentlink.protocol.api;

import java.util.List;

/**
 * Everything a connection is opened with. Replacing any of it means a new connection.
 */
public record ConnectionParams(
        String sessionId,
        SessionMode mode,
        boolean forceNew,
        boolean resume,
        SessionOptions options,
        List<FileReference> files
) {
    public ConnectionParams {
        options = options != null ? options : SessionOptions.defaults();
        files = files != null ? List.copyOf(files) : List.of();
    }

    public ConnectionParams withSessionId(String newSessionId) {
        return new ConnectionParams(newSessionId, mode, forceNew, resume, options, files);
    }

    public ConnectionParams withForceNew(boolean force) {
        return new ConnectionParams(sessionId, mode, force, resume, options, files);
    }

    public ConnectionParams withResume(boolean shouldResume) {
        return new ConnectionParams(sessionId, mode, forceNew, shouldResume, options, files);
    }

    public ConnectionParams withMode(SessionMode newMode) {
        return new ConnectionParams(sessionId, newMode, forceNew, resume, options, files);
    }
}

package io.github.drompincen.agentlink.runtime.connection;

import io.github.drompincen.agentlink.protocol.api.ErrorNotice;
import io.github.drompincen.agentlink.protocol.api.SessionSettings;

import java.util.List;

/**
 * Connection-level notifications raised by {@link ConnectionManager}. Content frames are not
 * reported here; they go through the connection's frame queue.
 */
public interface ConnectionEvents {

    /** A connection was created and its queue is ready to be drained. */
    default void onConnectionOpening(Connection connection) {}

    default void onConnected(Connection connection) {}

    default void onDisconnected(Connection connection, int code) {}

    default void onSessionIdAssigned(String sessionId) {}

    /** The requested session no longer exists remotely and was replaced by {@code newSessionId}. */
    default void onSessionReplaced(String oldSessionId, String newSessionId) {}

    default void onSettings(SessionSettings settings) {}

    default void onSlashCommands(List<String> commands) {}

    default void onError(ErrorNotice notice) {}
}

package io.github.drompincen.agentlink.runtime.session;

import io.github.drompincen.agentlink.protocol.api.ErrorNotice;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentlink.protocol.api.SessionSettings;
import io.github.drompincen.agentlink.protocol.api.TurnSnapshot;
import io.github.drompincen.agentlink.runtime.connection.ConnectionState;

import java.util.List;

/**
 * Observer of the reconstructed conversation state. Callbacks arrive on the consumption loop,
 * the transport thread or the scheduler; implementations must not block.
 */
public interface SessionListener {

    default void onTurnUpdated(TurnSnapshot turn) {}

    default void onStreamingChanged(boolean streaming) {}

    default void onPermissionRequested(PermissionRequestDto request) {}

    default void onPermissionResolved(PermissionRequestDto request) {}

    default void onError(ErrorNotice notice) {}

    default void onSessionIdAssigned(String sessionId) {}

    default void onSettingsChanged(SessionSettings settings) {}

    default void onSlashCommands(List<String> commands) {}

    default void onConnectionStateChanged(ConnectionState state) {}

    default void onHistoryCleared() {}
}

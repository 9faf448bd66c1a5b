package io.github.drompincen.agentlink.runtime.conversation;

import io.github.drompincen.agentlink.protocol.api.ContentPartDto;

/** A mutable part of the turn under construction. */
public interface TurnPart {

    ContentPartDto toDto();
}

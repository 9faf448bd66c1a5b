package io.github.drompincen.agentlink.runtime.connection;

import io.github.drompincen.agentlink.protocol.frame.Frame;

@FunctionalInterface
public interface FrameSender {

    /** @return false when the frame was dropped because no connection is open */
    boolean send(Frame frame);
}

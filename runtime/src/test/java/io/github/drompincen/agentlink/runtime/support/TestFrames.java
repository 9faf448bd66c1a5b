package io.github.drompincen.agentlink.runtime.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentlink.protocol.frame.Frame;
import io.github.drompincen.agentlink.protocol.frame.FrameCodec;

/**
 * Frames from JSON written with single quotes, to keep test literals readable.
 */
public final class TestFrames {

    public static final FrameCodec CODEC = new FrameCodec(new ObjectMapper());

    private TestFrames() {}

    public static String json(String singleQuoted) {
        return singleQuoted.replace('\'', '"');
    }

    public static Frame frame(String singleQuoted) {
        return CODEC.decode(json(singleQuoted))
                .orElseThrow(() -> new IllegalArgumentException("Not a frame: " + singleQuoted));
    }
}

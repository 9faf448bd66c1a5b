package io.github.drompincen.agentlink.runtime.conversation;

import io.github.drompincen.agentlink.protocol.api.ContentPartDto;

public class TextPart implements TurnPart {

    private String text;

    public TextPart(String text) {
        this.text = text != null ? text : "";
    }

    public String text() {
        return text;
    }

    /** Merged text never shrinks. */
    public void merge(String fragment) {
        text = TextMerge.merge(text, fragment);
    }

    public void prepend(String prefix) {
        text = prefix + text;
    }

    @Override
    public ContentPartDto toDto() {
        return ContentPartDto.text(text);
    }
}

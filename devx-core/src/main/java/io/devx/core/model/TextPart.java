package io.devx.core.model;

public record TextPart(String content) implements Part {

    public TextPart {
        content = content == null ? "" : content;
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }
}

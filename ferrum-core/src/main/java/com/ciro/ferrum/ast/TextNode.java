package com.ciro.ferrum.ast;

import java.util.Objects;

public record TextNode(String text) implements FrrNode {

    public TextNode {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitText(this);
    }
}

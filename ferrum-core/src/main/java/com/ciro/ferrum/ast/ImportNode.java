package com.ciro.ferrum.ast;

import java.util.List;
import java.util.Objects;

/** {@code import { create_signal } from "ferrum:state"} */
public record ImportNode(List<String> names, String source) implements FrrNode {

    public ImportNode {
        names = List.copyOf(names);
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitImport(this);
    }
}

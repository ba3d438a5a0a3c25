package com.ciro.ferrum.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Llamada a componente: {@code Button(onclick: set_count(-1))}.
 * Los valores de las props se guardan tal cual, sin interpretar.
 * Nunca se resuelve contra la definición del componente.
 */
public record ComponentNode(String name, Map<String, String> attributes, List<FrrNode> children) implements FrrNode {

    public ComponentNode {
        Objects.requireNonNull(name, "name must not be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    /** Un componente siempre puede tener hijos, aunque venga vacío. */
    @Override
    public boolean acceptsChildren() {
        return true;
    }

    public ComponentNode withChildren(List<FrrNode> newChildren) {
        return new ComponentNode(name, attributes, newChildren);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComponent(this);
    }
}

package com.ciro.ferrum.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Elemento HTML: {@code div#app.container title="x"}.
 * Los atributos conservan el orden de inserción; {@code id} y {@code class} son claves especiales.
 */
public record ElementNode(String tag, Map<String, String> attributes, List<FrrNode> children) implements FrrNode {

    /** Etiquetas que nunca reciben hijos, sin importar la indentación. */
    public static final Set<String> SELF_CLOSING_TAGS = Set.of("input", "img", "br", "hr", "meta", "link");

    public static final String ID = "id";
    public static final String CLASS = "class";

    public ElementNode {
        Objects.requireNonNull(tag, "tag must not be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    public static ElementNode of(String tag) {
        return new ElementNode(tag, Map.of(), List.of());
    }

    public Optional<String> id() {
        return Optional.ofNullable(attributes.get(ID));
    }

    public List<String> classes() {
        String value = attributes.get(CLASS);
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.trim().split("\\s+")).toList();
    }

    public boolean isSelfClosing() {
        return SELF_CLOSING_TAGS.contains(tag);
    }

    @Override
    public boolean acceptsChildren() {
        return !isSelfClosing();
    }

    public ElementNode withChildren(List<FrrNode> newChildren) {
        return new ElementNode(tag, attributes, newChildren);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitElement(this);
    }
}

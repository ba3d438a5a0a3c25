package com.ciro.ferrum.ast;

import java.util.List;

/**
 * Nodo del árbol de un archivo .frr.
 * Cada consumidor recorre el árbol con un {@link Visitor}: un nodo nuevo
 * agrega un método al visitor y obliga a tocar todos los consumidores.
 */
public interface FrrNode {

    <R> R accept(Visitor<R> visitor);

    default List<FrrNode> children() {
        return List.of();
    }

    /** Indica si el parser puede colgar líneas indentadas debajo de este nodo. */
    default boolean acceptsChildren() {
        return false;
    }

    interface Visitor<R> {
        R visitElement(ElementNode element);
        R visitText(TextNode text);
        R visitComponent(ComponentNode component);
        R visitStateBinding(StateBindingNode binding);
        R visitImport(ImportNode importNode);
    }
}

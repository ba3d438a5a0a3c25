package com.ciro.ferrum.ast;

import java.util.Objects;

/**
 * Lectura de una señal reactiva: {@code count} o {@code count.value}.
 * {@code member} es vacío cuando se lee la señal completa.
 */
public record StateBindingNode(String signal, String member) implements FrrNode {

    public StateBindingNode {
        Objects.requireNonNull(signal, "signal must not be null");
        member = member == null ? "" : member;
    }

    public static StateBindingNode of(String signal) {
        return new StateBindingNode(signal, "");
    }

    public boolean hasMember() {
        return !member.isEmpty();
    }

    public Expression toExpression() {
        return hasMember()
                ? new Expression.PropertyAccess(signal, member)
                : new Expression.SignalAccess(signal);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStateBinding(this);
    }
}

package com.ciro.ferrum.ast;

public enum BinaryOperator {
    ADD("+", 5),
    SUBTRACT("-", 5),
    MULTIPLY("*", 6),
    DIVIDE("/", 6),
    EQUALS("==", 3),
    NOT_EQUALS("!=", 3),
    GREATER_THAN(">", 4),
    LESS_THAN("<", 4),
    AND("&&", 2),
    OR("||", 1);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    /** Mayor valor = liga más fuerte. */
    public int precedence() {
        return precedence;
    }
}

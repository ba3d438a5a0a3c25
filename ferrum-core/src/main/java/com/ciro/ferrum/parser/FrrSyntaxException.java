package com.ciro.ferrum.parser;

/**
 * Error de sintaxis en una línea .frr. Siempre aborta el parseo completo.
 */
public class FrrSyntaxException extends Exception {

    private final int lineNumber;
    private final String lineText;

    public FrrSyntaxException(String reason, int lineNumber, String lineText) {
        super("Line " + lineNumber + ": " + reason + ": " + lineText);
        this.lineNumber = lineNumber;
        this.lineText = lineText;
    }

    /** Número de línea, empezando en 1. */
    public int getLineNumber() {
        return lineNumber;
    }

    /** Texto crudo de la línea que falló. */
    public String getLineText() {
        return lineText;
    }
}

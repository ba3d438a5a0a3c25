package com.ciro.ferrum.format;

import com.ciro.ferrum.parser.FrrSyntaxException;

import java.io.IOException;

/**
 * Fallo al formatear: la fuente no parsea o el destino no acepta la escritura.
 */
public class FrrFormatException extends Exception {

    public FrrFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    static FrrFormatException syntax(FrrSyntaxException cause) {
        return new FrrFormatException("Cannot format invalid source: " + cause.getMessage(), cause);
    }

    static FrrFormatException write(IOException cause) {
        return new FrrFormatException("Failed writing formatted output: " + cause.getMessage(), cause);
    }
}

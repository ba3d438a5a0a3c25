package com.ciro.ferrum.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer por líneas para .frr.
 * No hay construcciones multilínea: cada línea útil es un token con su indentación.
 */
public final class FrrLexer {

    public record Line(int number, int indent, String content, String raw) {}

    private FrrLexer() {}

    public static List<Line> lex(String source) {
        List<Line> lines = new ArrayList<>();
        if (source == null || source.isEmpty()) return lines;

        int number = 0;
        for (String raw : source.lines().toList()) {
            number++;
            String content = raw.strip();

            // Vacías y comentarios no existen para el parser
            if (content.isEmpty() || content.startsWith("//")) continue;

            int indent = raw.length() - raw.stripLeading().length();
            lines.add(new Line(number, indent, content, raw));
        }
        return lines;
    }
}

package com.ciro.ferrum.format;

/**
 * @param indentWidth caracteres por nivel de anidamiento (0 o más)
 * @param indentChar  carácter de indentación, normalmente espacio o tabulador; tiene que ser
 *                    un blanco que el lexer descarte, nunca un salto de línea
 */
public record FormatterOptions(int indentWidth, char indentChar) {

    public static final FormatterOptions DEFAULT = new FormatterOptions(4, ' ');

    public FormatterOptions {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be >= 0, got " + indentWidth);
        }
        if (!Character.isWhitespace(indentChar) || indentChar == '\n' || indentChar == '\r') {
            throw new IllegalArgumentException(
                    "indentChar must be a non-newline whitespace character, got code point " + (int) indentChar);
        }
    }

    public String indent(int depth) {
        return String.valueOf(indentChar).repeat(depth * indentWidth);
    }
}

package com.ciro.ferrum.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reglas léxicas compartidas del DSL: nombres válidos y cortes respetando comillas.
 * El formateador las usa para decidir si una forma corta vuelve a parsear igual.
 */
public final class FrrSyntax {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SIGNAL = Pattern.compile("[a-z_][A-Za-z0-9_]*");
    private static final Pattern TAG = Pattern.compile("[A-Za-z][A-Za-z0-9-]*");
    private static final Pattern CUSTOM_ELEMENT = Pattern.compile("[a-z][a-z0-9]*(-[a-z0-9]+)+");

    /**
     * Etiquetas HTML que el DSL reconoce como elemento cuando van solas en la línea.
     * Fuera quedan nombres que suelen ser señales (data, title, time...).
     */
    private static final Set<String> HTML_TAGS = Set.of(
            "a", "abbr", "address", "area", "article", "aside", "audio",
            "b", "base", "bdi", "bdo", "blockquote", "body", "br", "button",
            "canvas", "caption", "cite", "code", "col", "colgroup",
            "datalist", "dd", "del", "details", "dfn", "dialog", "div", "dl", "dt",
            "em", "embed", "fieldset", "figcaption", "figure", "footer", "form",
            "h1", "h2", "h3", "h4", "h5", "h6", "head", "header", "hgroup", "hr", "html",
            "i", "iframe", "img", "input", "ins", "kbd", "label", "legend", "li", "link",
            "main", "meta", "nav", "noscript",
            "ol", "optgroup", "option",
            "p", "picture", "pre", "progress", "q", "rp", "rt", "ruby",
            "s", "samp", "script", "section", "select", "slot", "small",
            "span", "strong", "style", "sub", "summary", "sup", "svg",
            "table", "tbody", "td", "template", "textarea", "tfoot", "th", "thead",
            "tr", "track", "u", "ul", "video", "wbr");

    private FrrSyntax() {}

    public static boolean isIdentifier(String s) {
        return IDENTIFIER.matcher(s).matches();
    }

    /** Nombre de señal: identificador que empieza en minúscula o guion bajo. */
    public static boolean isSignalName(String s) {
        return SIGNAL.matcher(s).matches();
    }

    public static boolean isTagName(String s) {
        return TAG.matcher(s).matches();
    }

    /** Etiqueta HTML conocida o custom element (lleva guion). */
    public static boolean isElementName(String s) {
        return HTML_TAGS.contains(s) || CUSTOM_ELEMENT.matcher(s).matches();
    }

    /**
     * Parte por espacios sin cortar dentro de comillas dobles.
     * {@code h1 title="a b" "Hola mundo"} → {@code [h1, title="a b", "Hola mundo"]}
     */
    public static List<String> splitTokens(String s) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
                current.append(c);
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (!current.isEmpty()) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (!current.isEmpty()) tokens.add(current.toString());
        return tokens;
    }

    /**
     * Parte por {@code separator} solo al nivel superior: ignora los que estén
     * dentro de comillas, paréntesis, corchetes o llaves.
     */
    public static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean inQuote = false;
        int start = 0;

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (inQuote) {
                continue;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    /** Primera aparición de {@code target} fuera de comillas, o -1. */
    public static int indexOfUnquoted(String s, char target, int from) {
        boolean inQuote = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (!inQuote && c == target && i >= from) {
                return i;
            }
        }
        return -1;
    }

    /** Posición del ')' que cierra el '(' en {@code open}, o -1 si no cierra. */
    public static int findClosingParen(String s, int open) {
        int depth = 0;
        boolean inQuote = false;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (inQuote) {
                continue;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /** {@code "abc"} → {@code abc}; null si no es un literal entre comillas. */
    public static String unquote(String token) {
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            return token.substring(1, token.length() - 1);
        }
        return null;
    }
}

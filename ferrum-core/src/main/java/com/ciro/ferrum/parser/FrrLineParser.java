package com.ciro.ferrum.parser;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.ImportNode;
import com.ciro.ferrum.ast.StateBindingNode;
import com.ciro.ferrum.ast.TextNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convierte el contenido de UNA línea (ya sin indentación) en un nodo.
 * Orden de prioridad: texto entre comillas, import, llamada a componente,
 * elemento con {@code <...>}, token suelto y, por defecto, forma corta {@code tag#id.clase}.
 */
public final class FrrLineParser {

    private static final Pattern IMPORT = Pattern.compile("import\\s*\\{([^}]*)}\\s*from\\s*\"([^\"]*)\"");
    private static final Pattern COMPONENT_HEAD = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(\\s*)\\(");
    private static final Pattern MEMBER_ACCESS =
            Pattern.compile("([a-z_][A-Za-z0-9_]*)\\.([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)");

    private static final String DEFAULT_TAG = "div";

    private FrrLineParser() {}

    public static FrrNode parse(String content, int lineNumber) throws FrrSyntaxException {
        return parse(content, lineNumber, content);
    }

    /**
     * @param rawLine la línea tal cual venía en el archivo (con indentación);
     *                es lo que se reporta en los errores de sintaxis
     */
    public static FrrNode parse(String content, int lineNumber, String rawLine) throws FrrSyntaxException {
        if (content.startsWith("\"")) {
            return parseQuotedText(content);
        }
        if (isImport(content)) {
            return parseImport(content, lineNumber, rawLine);
        }

        Matcher head = COMPONENT_HEAD.matcher(content);
        if (head.lookingAt() && isComponentCall(content, head)) {
            return parseComponent(content, head.group(1), head.end() - 1, lineNumber, rawLine);
        }

        if (FrrSyntax.indexOfUnquoted(content, '<', 0) >= 0) {
            return parseBracketed(content, lineNumber, rawLine);
        }

        if (content.chars().noneMatch(Character::isWhitespace)) {
            FrrNode single = parseSingleToken(content);
            if (single != null) return single;
        }

        return parseShorthand(content);
    }

    private static FrrNode parseQuotedText(String content) {
        String inner = FrrSyntax.unquote(content);
        // Comilla sin cerrar: la línea entera es texto
        return new TextNode(inner != null ? inner : content);
    }

    private static boolean isImport(String content) {
        if (!content.startsWith("import") || content.length() == "import".length()) return false;
        char next = content.charAt("import".length());
        return Character.isWhitespace(next) || next == '{';
    }

    private static FrrNode parseImport(String content, int lineNumber, String rawLine) throws FrrSyntaxException {
        Matcher m = IMPORT.matcher(content);
        if (!m.matches()) {
            throw new FrrSyntaxException("Malformed import declaration", lineNumber, rawLine);
        }
        List<String> names = Arrays.stream(m.group(1).split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
        return new ImportNode(names, m.group(2));
    }

    // ==============================================================
    // Componentes: Nombre(clave: valor, clave: valor)
    // ==============================================================

    /**
     * {@code Nombre(} pegado siempre es una llamada. Con espacios antes del paréntesis
     * ({@code Nombre (x: 1)}) solo lo es si la línea termina justo en el paréntesis que
     * lo cierra; si no, la línea sigue su camino como texto o forma corta.
     */
    private static boolean isComponentCall(String content, Matcher head) {
        if (head.group(2).isEmpty()) return true;
        return FrrSyntax.findClosingParen(content, head.end() - 1) == content.length() - 1;
    }

    private static FrrNode parseComponent(String content, String name, int open, int lineNumber, String rawLine)
            throws FrrSyntaxException {
        int close = FrrSyntax.findClosingParen(content, open);
        if (close < 0) {
            throw new FrrSyntaxException("Unterminated component call", lineNumber, rawLine);
        }
        if (!content.substring(close + 1).isBlank()) {
            throw new FrrSyntaxException("Unexpected content after component call", lineNumber, rawLine);
        }
        Map<String, String> props = parseProps(content.substring(open + 1, close));
        return new ComponentNode(name, props, List.of());
    }

    private static Map<String, String> parseProps(String args) {
        Map<String, String> props = new LinkedHashMap<>();
        if (args.isBlank()) return props;

        for (String segment : FrrSyntax.splitTopLevel(args, ',')) {
            int colon = segment.indexOf(':');
            if (colon < 0) continue;
            String key = segment.substring(0, colon).strip();
            if (key.isEmpty()) continue;
            props.put(key, segment.substring(colon + 1).strip());
        }
        return props;
    }

    // ==============================================================
    // Elementos con corchetes: <tag clave="valor"> texto </tag>
    // ==============================================================

    private static FrrNode parseBracketed(String content, int lineNumber, String rawLine) throws FrrSyntaxException {
        int open = FrrSyntax.indexOfUnquoted(content, '<', 0);
        int close = FrrSyntax.indexOfUnquoted(content, '>', open);
        if (close < 0) {
            throw new FrrSyntaxException("Malformed element, missing '>'", lineNumber, rawLine);
        }

        String inner = content.substring(open + 1, close).strip();
        if (inner.endsWith("/")) {
            inner = inner.substring(0, inner.length() - 1).strip();
        }

        List<String> tokens = FrrSyntax.splitTokens(inner);
        if (tokens.isEmpty() || !FrrSyntax.isTagName(tokens.get(0))) {
            throw new FrrSyntaxException("Malformed element, missing tag name", lineNumber, rawLine);
        }

        String tag = tokens.get(0);
        Attributes attrs = new Attributes();
        for (String token : tokens.subList(1, tokens.size())) {
            attrs.addPair(token);
        }

        List<FrrNode> children = new ArrayList<>();
        String trailing = content.substring(close + 1).strip();
        String closingTag = "</" + tag + ">";
        if (trailing.endsWith(closingTag)) {
            trailing = trailing.substring(0, trailing.length() - closingTag.length()).strip();
        }
        if (!trailing.isEmpty()) {
            String quoted = FrrSyntax.unquote(trailing);
            children.add(new TextNode(quoted != null ? quoted : trailing));
        }

        return element(tag, attrs, children);
    }

    // ==============================================================
    // Token suelto: etiqueta, señal, señal.miembro o texto
    // ==============================================================

    private static FrrNode parseSingleToken(String token) {
        if (token.indexOf('#') < 0 && token.indexOf('.') < 0 && token.indexOf('(') < 0) {
            if (FrrSyntax.isElementName(token)) return ElementNode.of(token);
            if (FrrSyntax.isSignalName(token)) return StateBindingNode.of(token);
            return new TextNode(token);
        }

        Matcher m = MEMBER_ACCESS.matcher(token);
        if (m.matches() && !FrrSyntax.isElementName(m.group(1))) {
            return new StateBindingNode(m.group(1), m.group(2));
        }
        return null;
    }

    // ==============================================================
    // Forma corta: tag#id.clase1.clase2 .otra clave="valor" "texto"
    // ==============================================================

    private static FrrNode parseShorthand(String content) {
        List<String> tokens = FrrSyntax.splitTokens(content);
        String head = tokens.get(0);

        int cut = firstSelector(head, 0);
        String tag = head.substring(0, cut);
        if (tag.isEmpty()) {
            tag = DEFAULT_TAG;
        } else if (!FrrSyntax.isTagName(tag)) {
            return new TextNode(content);
        }
        // Un selector con comillas (div.y", p.title="a b") no es un selector: es texto
        if (head.indexOf('"') >= 0) {
            return new TextNode(content);
        }

        Attributes attrs = new Attributes();
        while (cut < head.length()) {
            int next = firstSelector(head, cut + 1);
            String value = head.substring(cut + 1, next);
            if (head.charAt(cut) == '#') {
                attrs.setId(value);
            } else {
                attrs.addClass(value);
            }
            cut = next;
        }

        List<FrrNode> children = new ArrayList<>();
        for (String token : tokens.subList(1, tokens.size())) {
            String text = FrrSyntax.unquote(token);
            if (text != null) {
                children.add(new TextNode(text));
            } else if (token.startsWith(".")) {
                for (String cls : token.split("\\.")) attrs.addClass(cls);
            } else {
                attrs.addPair(token);
            }
        }

        return element(tag, attrs, children);
    }

    private static int firstSelector(String head, int from) {
        for (int i = from; i < head.length(); i++) {
            char c = head.charAt(i);
            if (c == '#' || c == '.') return i;
        }
        return head.length();
    }

    private static ElementNode element(String tag, Attributes attrs, List<FrrNode> children) {
        ElementNode el = new ElementNode(tag, attrs.toMap(), List.of());
        // Las etiquetas de auto-cierre nunca reciben hijos, tampoco el texto en línea
        return el.isSelfClosing() ? el : el.withChildren(children);
    }

    /**
     * Acumula atributos de un elemento y los deja en orden canónico:
     * id, class y luego el resto en orden de aparición.
     */
    private static final class Attributes {
        private static final Pattern ATTRIBUTE_NAME = Pattern.compile("[^\\s\"'<>=/]+");

        private String id;
        private final Set<String> classes = new LinkedHashSet<>();
        private final Map<String, String> others = new LinkedHashMap<>();

        void setId(String value) {
            if (!value.isEmpty() && value.indexOf('"') < 0) id = value;
        }

        void addClass(String value) {
            for (String cls : value.strip().split("\\s+")) {
                if (!cls.isEmpty() && cls.indexOf('"') < 0) classes.add(cls);
            }
        }

        /**
         * Solo acepta {@code clave="valor"} con un nombre de atributo válido y sin comillas
         * dentro del valor; lo demás se descarta en silencio.
         */
        void addPair(String token) {
            int eq = token.indexOf('=');
            if (eq <= 0) return;
            String key = token.substring(0, eq);
            String value = FrrSyntax.unquote(token.substring(eq + 1));
            if (value == null || value.indexOf('"') >= 0 || !ATTRIBUTE_NAME.matcher(key).matches()) return;

            switch (key) {
                case ElementNode.ID -> setId(value);
                case ElementNode.CLASS -> addClass(value);
                default -> others.put(key, value);
            }
        }

        Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            if (id != null) map.put(ElementNode.ID, id);
            if (!classes.isEmpty()) map.put(ElementNode.CLASS, String.join(" ", classes));
            map.putAll(others);
            return map;
        }
    }
}

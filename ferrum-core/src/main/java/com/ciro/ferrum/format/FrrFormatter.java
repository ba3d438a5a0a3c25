package com.ciro.ferrum.format;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.Expression;
import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.ImportNode;
import com.ciro.ferrum.ast.StateBindingNode;
import com.ciro.ferrum.ast.TextNode;
import com.ciro.ferrum.parser.FrrLineParser;
import com.ciro.ferrum.parser.FrrParser;
import com.ciro.ferrum.parser.FrrSyntax;
import com.ciro.ferrum.parser.FrrSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Re-emite un archivo .frr en forma canónica.
 *
 * <p>Cada nodo ocupa una línea, los hijos van un nivel más adentro. La salida
 * siempre vuelve a parsear al mismo árbol, así que formatear dos veces da lo mismo.
 * Instancias inmutables: se pueden compartir entre hilos.
 */
public final class FrrFormatter {

    private static final Logger log = LoggerFactory.getLogger(FrrFormatter.class);

    private final FormatterOptions options;

    public FrrFormatter() {
        this(FormatterOptions.DEFAULT);
    }

    public FrrFormatter(FormatterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public FormatterOptions options() {
        return options;
    }

    public String format(String source) throws FrrFormatException {
        try {
            return format(FrrParser.parse(source));
        } catch (FrrSyntaxException e) {
            throw FrrFormatException.syntax(e);
        }
    }

    public void format(String source, Appendable sink) throws FrrFormatException {
        String formatted = format(source);
        try {
            sink.append(formatted);
        } catch (IOException e) {
            throw FrrFormatException.write(e);
        }
    }

    public String format(List<FrrNode> forest) {
        StringBuilder out = new StringBuilder();
        for (FrrNode node : forest) {
            write(node, 0, out);
        }
        log.debug("Formatted {} top-level nodes ({} chars)", forest.size(), out.length());
        return out.toString();
    }

    public String formatExpression(Expression expression) {
        return ExpressionPrinter.print(expression);
    }

    private void write(FrrNode node, int depth, StringBuilder out) {
        out.append(options.indent(depth)).append(node.accept(LineRenderer.INSTANCE)).append('\n');
        for (FrrNode child : node.children()) {
            write(child, depth + 1, out);
        }
    }

    // ==============================================================
    // Una línea por nodo (sin indentación ni hijos)
    // ==============================================================

    private static final class LineRenderer implements FrrNode.Visitor<String> {

        static final LineRenderer INSTANCE = new LineRenderer();

        @Override
        public String visitElement(ElementNode element) {
            return canUseShorthand(element) ? shorthand(element) : bracketed(element);
        }

        @Override
        public String visitText(TextNode text) {
            String value = text.text();
            return needsQuotes(value) ? "\"" + value + "\"" : value;
        }

        @Override
        public String visitComponent(ComponentNode component) {
            String props = component.attributes().entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", "));
            return component.name() + "(" + props + ")";
        }

        @Override
        public String visitStateBinding(StateBindingNode binding) {
            return ExpressionPrinter.print(binding.toExpression());
        }

        @Override
        public String visitImport(ImportNode importNode) {
            String names = String.join(", ", importNode.names());
            return names.isEmpty()
                    ? "import {} from \"" + importNode.source() + "\""
                    : "import { " + names + " } from \"" + importNode.source() + "\"";
        }

        private static String shorthand(ElementNode element) {
            StringBuilder line = new StringBuilder(element.tag());
            element.id().ifPresent(id -> line.append('#').append(id));
            for (String cls : element.classes()) {
                line.append('.').append(cls);
            }
            appendOtherAttributes(element, line);
            return line.toString();
        }

        private static String bracketed(ElementNode element) {
            StringBuilder line = new StringBuilder("<").append(element.tag());
            element.id().ifPresent(id -> line.append(" id=\"").append(id).append('"'));
            List<String> classes = element.classes();
            if (!classes.isEmpty()) {
                line.append(" class=\"").append(String.join(" ", classes)).append('"');
            }
            appendOtherAttributes(element, line);
            return line.append('>').toString();
        }

        private static void appendOtherAttributes(ElementNode element, StringBuilder line) {
            for (Map.Entry<String, String> attr : element.attributes().entrySet()) {
                if (isSpecial(attr.getKey())) continue;
                line.append(' ').append(attr.getKey()).append("=\"").append(attr.getValue()).append('"');
            }
        }

        private static boolean isSpecial(String key) {
            return ElementNode.ID.equals(key) || ElementNode.CLASS.equals(key);
        }

        /**
         * La forma corta solo sirve si la cabecera vuelve a leerse como el mismo elemento:
         * etiqueta conocida y selectores sin caracteres que el parser interprete.
         */
        private static boolean canUseShorthand(ElementNode element) {
            if (!FrrSyntax.isElementName(element.tag())) return false;
            if (element.id().isPresent() && !isPlainSelector(element.id().get())) return false;
            for (String cls : element.classes()) {
                if (!isPlainSelector(cls)) return false;
            }
            for (String key : element.attributes().keySet()) {
                if (!isSpecial(key) && (key.startsWith(".") || key.startsWith("\""))) return false;
            }
            return true;
        }

        private static boolean isPlainSelector(String value) {
            if (value.isEmpty()) return false;
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '.' || c == '#' || c == '"' || c == '<' || c == '>' || Character.isWhitespace(c)) {
                    return false;
                }
            }
            return true;
        }

        /** Texto con espacios, o que sin comillas se leería como otra cosa (etiqueta, señal...). */
        private static boolean needsQuotes(String text) {
            if (text.isEmpty() || text.startsWith("//") || text.chars().anyMatch(Character::isWhitespace)) {
                return true;
            }
            try {
                return !new TextNode(text).equals(FrrLineParser.parse(text, 0));
            } catch (FrrSyntaxException e) {
                return true;
            }
        }
    }
}

package com.ciro.ferrum.codegen;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.ImportNode;
import com.ciro.ferrum.ast.StateBindingNode;
import com.ciro.ferrum.ast.TextNode;

import java.util.List;
import java.util.Map;

/**
 * Emite el bosque como un bloque {@code view! { ... }} del framework destino.
 *
 * <pre>
 * view! {
 *     &lt;div id="app"&gt;
 *         "Hola"
 *         {read(count)}
 *         &lt;Button onclick={set_count(-1)}/&gt;
 *     &lt;/div&gt;
 * }
 * </pre>
 */
public final class ViewCodeGenerator {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final int indentWidth;

    public ViewCodeGenerator() {
        this(DEFAULT_INDENT_WIDTH);
    }

    public ViewCodeGenerator(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must be >= 0, got " + indentWidth);
        }
        this.indentWidth = indentWidth;
    }

    public int indentWidth() {
        return indentWidth;
    }

    public String toViewCode(List<FrrNode> forest) {
        StringBuilder sb = new StringBuilder("view! {\n");
        ViewRenderer renderer = new ViewRenderer(sb);
        for (FrrNode node : forest) {
            renderer.render(node, 1);
        }
        return sb.append("}\n").toString();
    }

    /** Literal de cadena con comillas dobles y escapes básicos. */
    static String stringLiteral(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    private final class ViewRenderer implements FrrNode.Visitor<Void> {

        private final StringBuilder sb;
        private int depth;

        ViewRenderer(StringBuilder sb) {
            this.sb = sb;
        }

        void render(FrrNode node, int atDepth) {
            int saved = depth;
            depth = atDepth;
            node.accept(this);
            depth = saved;
        }

        @Override
        public Void visitElement(ElementNode el) {
            StringBuilder open = new StringBuilder("<").append(el.tag());
            for (Map.Entry<String, String> attr : el.attributes().entrySet()) {
                open.append(' ').append(attr.getKey()).append("=\"").append(attr.getValue()).append('"');
            }
            tag(el.tag(), open, el.isSelfClosing() ? List.of() : el.children());
            return null;
        }

        @Override
        public Void visitComponent(ComponentNode component) {
            StringBuilder open = new StringBuilder("<").append(component.name());
            for (Map.Entry<String, String> attr : component.attributes().entrySet()) {
                open.append(' ').append(attr.getKey()).append("={").append(attr.getValue()).append('}');
            }
            tag(component.name(), open, component.children());
            return null;
        }

        @Override
        public Void visitText(TextNode text) {
            line(stringLiteral(text.text()));
            return null;
        }

        @Override
        public Void visitStateBinding(StateBindingNode binding) {
            String target = binding.hasMember() ? binding.signal() + "." + binding.member() : binding.signal();
            line("{read(" + target + ")}");
            return null;
        }

        @Override
        public Void visitImport(ImportNode importNode) {
            return null;
        }

        private void tag(String name, StringBuilder open, List<FrrNode> children) {
            List<FrrNode> rendered = children.stream().filter(c -> !(c instanceof ImportNode)).toList();
            if (rendered.isEmpty()) {
                line(open.append("/>").toString());
                return;
            }
            line(open.append('>').toString());
            for (FrrNode child : rendered) render(child, depth + 1);
            line("</" + name + ">");
        }

        private void line(String content) {
            sb.append(" ".repeat(depth * indentWidth)).append(content).append('\n');
        }
    }
}

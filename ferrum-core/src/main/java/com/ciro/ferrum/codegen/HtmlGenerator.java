package com.ciro.ferrum.codegen;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.ImportNode;
import com.ciro.ferrum.ast.StateBindingNode;
import com.ciro.ferrum.ast.TextNode;
import org.jsoup.nodes.Entities;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Genera HTML estático a partir del bosque. Sin JavaScript.
 *
 * <p>Los componentes no se resuelven: quedan como un {@code <div data-component='Nombre'>}
 * con sus props en atributos {@code data-*}. El texto y los valores de atributos
 * se emiten tal cual, sin escapar.
 */
public final class HtmlGenerator {

    private final HtmlOptions options;

    public HtmlGenerator() {
        this(HtmlOptions.defaults());
    }

    public HtmlGenerator(HtmlOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public HtmlOptions options() {
        return options;
    }

    /** Documento completo: doctype, head con la hoja de estilos y el bosque dentro del contenedor raíz. */
    public String toHtml(List<FrrNode> forest) {
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>");
        sb.append("<html lang='").append(Entities.escape(options.lang())).append("'>");
        sb.append("<head>");
        sb.append("<meta charset='UTF-8'>");
        sb.append("<meta name='viewport' content='width=device-width, initial-scale=1.0'>");
        sb.append("<title>").append(Entities.escape(options.title())).append("</title>");
        sb.append("<style>").append(options.stylesheet().css()).append("</style>");
        sb.append("</head>");
        sb.append("<body>");
        sb.append("<div id='").append(Entities.escape(options.rootId())).append("'>");
        renderNodes(forest, sb);
        sb.append("</div>");
        sb.append("</body>");
        sb.append("</html>");
        return sb.toString();
    }

    /** Solo el bosque renderizado, sin el armazón del documento. */
    public String toBodyHtml(List<FrrNode> forest) {
        StringBuilder sb = new StringBuilder();
        renderNodes(forest, sb);
        return sb.toString();
    }

    /** Página de error independiente; a diferencia del resto, el mensaje sí se escapa. */
    public String errorPage(String message) {
        String safe = Entities.escape(message == null ? "" : message);
        return "<!DOCTYPE html>"
                + "<html lang='" + Entities.escape(options.lang()) + "'>"
                + "<head>"
                + "<meta charset='UTF-8'>"
                + "<title>Ferrum Error</title>"
                + "<style>"
                + "body{font-family:system-ui,sans-serif;background:#1a1a1a;color:white;margin:0;padding:2rem}"
                + ".error-container{max-width:600px;margin:0 auto;background:#2d2d2d;border-radius:8px;"
                + "padding:2rem;border:1px solid #ef4444}"
                + ".error-title{color:#ef4444;font-size:1.5rem;margin-bottom:1rem}"
                + ".error-message{font-size:1rem;line-height:1.5;white-space:pre-wrap}"
                + "</style>"
                + "</head>"
                + "<body>"
                + "<div class='error-container'>"
                + "<h1 class='error-title'>⚠️ Ferrum Compilation Error</h1>"
                + "<p class='error-message'>" + safe + "</p>"
                + "</div>"
                + "</body>"
                + "</html>";
    }

    private static void renderNodes(List<FrrNode> nodes, StringBuilder sb) {
        HtmlRenderer renderer = new HtmlRenderer(sb);
        for (FrrNode n : nodes) n.accept(renderer);
    }

    // ==============================================================
    // Render por tipo de nodo
    // ==============================================================

    private static final class HtmlRenderer implements FrrNode.Visitor<Void> {

        private final StringBuilder sb;

        HtmlRenderer(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitElement(ElementNode el) {
            sb.append("<").append(el.tag());
            appendAttributes(el.attributes(), "");

            if (el.isSelfClosing()) {
                sb.append("/>");
                return null;
            }

            sb.append(">");
            for (FrrNode child : el.children()) child.accept(this);
            sb.append("</").append(el.tag()).append(">");
            return null;
        }

        @Override
        public Void visitText(TextNode text) {
            sb.append(text.text());
            return null;
        }

        @Override
        public Void visitComponent(ComponentNode component) {
            sb.append("<div data-component='").append(component.name()).append("'");
            appendAttributes(component.attributes(), "data-");
            sb.append(">");
            for (FrrNode child : component.children()) child.accept(this);
            sb.append("</div>");
            return null;
        }

        // Las lecturas de señales y los imports no tienen representación estática
        @Override
        public Void visitStateBinding(StateBindingNode binding) {
            return null;
        }

        @Override
        public Void visitImport(ImportNode importNode) {
            return null;
        }

        private void appendAttributes(Map<String, String> attributes, String prefix) {
            for (Map.Entry<String, String> attr : attributes.entrySet()) {
                sb.append(" ").append(prefix).append(attr.getKey())
                        .append("='").append(attr.getValue()).append("'");
            }
        }
    }
}

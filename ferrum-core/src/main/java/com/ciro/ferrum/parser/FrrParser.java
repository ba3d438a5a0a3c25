package com.ciro.ferrum.parser;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.FrrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ensamblador O(N). Convierte las líneas del Lexer en un bosque de nodos (AST).
 *
 * <p>El anidamiento sale de la indentación: se guarda una pila de padres abiertos
 * con su indentación real y se cierran todos los que tengan indentación mayor o
 * igual a la línea nueva. Funciona con cualquier ancho de indentación consistente.
 */
public final class FrrParser {

    private static final Logger log = LoggerFactory.getLogger(FrrParser.class);

    private FrrParser() {}

    public static List<FrrNode> parse(String source) throws FrrSyntaxException {
        List<FrrLexer.Line> lines = FrrLexer.lex(source);
        List<Draft> roots = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        Frame previous = null;

        for (FrrLexer.Line line : lines) {
            FrrNode node = FrrLineParser.parse(line.content(), line.number(), line.raw());

            while (!stack.isEmpty() && stack.peek().indent() >= line.indent()) {
                stack.pop();
            }

            if (previous != null && line.indent() > previous.indent() && !previous.draft().head().acceptsChildren()) {
                warnIgnoredNesting(previous, line);
            }

            Draft draft = new Draft(node);
            if (stack.isEmpty()) {
                roots.add(draft);
            } else {
                stack.peek().draft().children().add(draft);
            }

            Frame frame = new Frame(draft, line.indent());
            if (node.acceptsChildren()) {
                stack.push(frame);
            }
            previous = frame;
        }

        List<FrrNode> forest = roots.stream().map(Draft::build).toList();
        log.debug("Parsed {} top-level nodes from {} lines", forest.size(), lines.size());
        return forest;
    }

    private static void warnIgnoredNesting(Frame leaf, FrrLexer.Line line) {
        if (leaf.draft().head() instanceof ElementNode el && el.isSelfClosing()) {
            log.warn("Line {}: <{}> takes no children, indented content is attached to its parent instead",
                    line.number(), el.tag());
        } else {
            log.debug("Line {}: indentation under a leaf node ignored", line.number());
        }
    }

    private record Frame(Draft draft, int indent) {}

    /** Nodo en construcción: la cabecera inmutable más los hijos que van llegando. */
    private record Draft(FrrNode head, List<Draft> children) {

        Draft(FrrNode head) {
            this(head, new ArrayList<>());
        }

        FrrNode build() {
            if (children.isEmpty()) return head;

            List<FrrNode> built = new ArrayList<>(head.children());
            for (Draft child : children) built.add(child.build());

            if (head instanceof ElementNode el) return el.withChildren(built);
            if (head instanceof ComponentNode component) return component.withChildren(built);
            return head;
        }
    }
}

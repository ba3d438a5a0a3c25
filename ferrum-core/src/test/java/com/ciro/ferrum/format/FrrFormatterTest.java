package com.ciro.ferrum.format;

import com.ciro.ferrum.ast.ComponentNode;
import com.ciro.ferrum.ast.ElementNode;
import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.ImportNode;
import com.ciro.ferrum.ast.StateBindingNode;
import com.ciro.ferrum.ast.TextNode;
import com.ciro.ferrum.parser.FrrParser;
import com.ciro.ferrum.parser.FrrSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrrFormatterTest {

    private final FrrFormatter formatter = new FrrFormatter();

    @Test
    void writesCanonicalLayout() throws Exception {
        String source = """
                div#app.container
                  h1.title "Hello World"
                  p.text-gray-600    "Welcome"
                """;

        assertThat(formatter.format(source)).isEqualTo("""
                div#app.container
                    h1.title
                        "Hello World"
                    p.text-gray-600
                        Welcome
                """);
    }

    @Test
    void normalizesExplicitAttributesToShorthand() throws Exception {
        assertThat(formatter.format("a title=\"home page\" class=\"nav  main\" id=\"top\" href=\"/\""))
                .isEqualTo("a#top.nav.main title=\"home page\" href=\"/\"\n");
    }

    @Test
    void formatsEveryNodeKind() throws Exception {
        String source = """
                import {create_signal,Button} from "ferrum:state"
                Counter(initial:0,step: 2)
                    count
                    count.value
                    Button(onclick: set_count(-1))
                        "-"
                """;

        assertThat(formatter.format(source)).isEqualTo("""
                import { create_signal, Button } from "ferrum:state"
                Counter(initial: 0, step: 2)
                    count
                    count.value
                    Button(onclick: set_count(-1))
                        -
                """);
    }

    @Test
    void quotesTextThatWouldReparseAsSomethingElse() {
        List<FrrNode> forest = List.of(
                new TextNode("Hello"),
                new TextNode("two words"),
                new TextNode("p"),
                new TextNode("count"),
                new TextNode("user.name"),
                new TextNode(""),
                new TextNode("Go("),
                new TextNode("//not-a-comment"));

        assertThat(formatter.format(forest)).isEqualTo("""
                Hello
                "two words"
                "p"
                "count"
                "user.name"
                ""
                "Go("
                "//not-a-comment"
                """);
    }

    @Test
    void fallsBackToBracketedFormWhenShorthandWouldChangeMeaning() {
        List<FrrNode> forest = List.of(
                new ElementNode("custom", Map.of("id", "x"), List.of()),
                new ElementNode("div", Map.of("class", "a.b"), List.of()),
                ElementNode.of("Panel"));

        assertThat(formatter.format(forest)).isEqualTo("""
                <custom id="x">
                <div class="a.b">
                <Panel>
                """);
    }

    @Test
    void bracketedSourceRoundTripsThroughCanonicalForm() throws Exception {
        String formatted = formatter.format("<widget data-x=\"1\">Text inside</widget>");

        assertThat(formatted).isEqualTo("<widget data-x=\"1\">\n    \"Text inside\"\n");
        assertThat(FrrParser.parse(formatted)).isEqualTo(FrrParser.parse("<widget data-x=\"1\">Text inside</widget>"));
    }

    @Test
    void honoursIndentOptions() throws Exception {
        String source = "ul\n    li\n        span\n";

        assertThat(new FrrFormatter(new FormatterOptions(2, ' ')).format(source)).isEqualTo("ul\n  li\n    span\n");
        assertThat(new FrrFormatter(new FormatterOptions(1, '\t')).format(source)).isEqualTo("ul\n\tli\n\t\tspan\n");
        assertThat(new FrrFormatter(new FormatterOptions(0, ' ')).format(source)).isEqualTo("ul\nli\nspan\n");
    }

    @Test
    void rejectsNegativeIndentWidth() {
        assertThatThrownBy(() -> new FormatterOptions(-1, ' '))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(chars = {'-', 'x', '.', '\n', '\r'})
    void rejectsIndentCharsTheLexerWouldNotSkip(char indentChar) {
        assertThatThrownBy(() -> new FormatterOptions(2, indentChar))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("indentChar");
    }

    @Test
    void nestedSourceStaysIdempotentWithTabs() throws Exception {
        FrrFormatter tabs = new FrrFormatter(new FormatterOptions(1, '\t'));
        String once = tabs.format("div\n  p.x \"hi there\"");

        assertThat(tabs.format(once)).isEqualTo(once);
    }

    @Test
    void emptySourceFormatsToEmptyString() throws Exception {
        assertThat(formatter.format("")).isEmpty();
        assertThat(formatter.format("// nothing here\n\n")).isEmpty();
    }

    @Test
    void wrapsSyntaxErrors() {
        assertThatThrownBy(() -> formatter.format("Button(onclick: go("))
                .isInstanceOf(FrrFormatException.class)
                .hasMessageStartingWith("Cannot format invalid source")
                .hasCauseInstanceOf(FrrSyntaxException.class);
    }

    @Test
    void writesIntoAppendable() throws Exception {
        StringBuilder sink = new StringBuilder("// header\n");

        formatter.format("div\n  p", sink);

        assertThat(sink).hasToString("// header\ndiv\n    p\n");
    }

    @Test
    void sinkFailureBecomesFormatException() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> formatter.format("div", broken))
                .isInstanceOf(FrrFormatException.class)
                .hasMessageContaining("disk full")
                .hasCauseInstanceOf(IOException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"counter.frr", "landing.frr", "edge-cases.frr"})
    void formattingIsIdempotent(String sample) throws Exception {
        String source = sample(sample);

        String once = formatter.format(source);

        assertThat(formatter.format(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"counter.frr", "landing.frr", "edge-cases.frr"})
    void formattingPreservesForestShape(String sample) throws Exception {
        String source = sample(sample);

        List<FrrNode> before = FrrParser.parse(source);
        List<FrrNode> after = FrrParser.parse(formatter.format(source));

        assertSameShape(after, before);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "div.y\"",
            ".y\"",
            "p.title=\"a b\"",
            "fooHello.title=\"a b\"",
            "#class=\"c d\"p",
            "div.x\"y z",
            "\"stray",
            "x\"y",
            "\"a \"b\" c\"",
            "custom-el.a",
            "x-y \"a\"",
            "Div.x",
            "<widget a=\"1\">",
            "<Panel id=\"a b\" class=\"x.y\">",
            "<div class=\"a.b\">",
            "<foo a>b=\"c\">",
            "div.a=b",
            "a.b.c",
            "span#i.c k=\"v w\"",
            "span k=\"a\"b\"",
            "div data-x=\"<b>\"",
            "img.hero src=\"a.png\" \"caption\"",
            "foo.bar",
            "fooHello.x",
            "Button (x: 1)",
            "Card(title: \"x, y\", f: g(1, 2))"})
    void edgeLinesFormatIdempotentlyAndKeepTheirTree(String line) throws Exception {
        String once = formatter.format(line);

        assertThat(formatter.format(once)).as("idempotent for %s", line).isEqualTo(once);
        assertThat(FrrParser.parse(once)).as("same tree for %s", line).isEqualTo(FrrParser.parse(line));
    }

    @Test
    void quoteBearingSelectorsFormatAsText() throws Exception {
        assertThat(formatter.format("div.y\"")).isEqualTo("div.y\"\n");
        assertThat(formatter.format("p.title=\"a b\"")).isEqualTo("\"p.title=\"a b\"\"\n");
    }

    @Test
    void formatsExpressions() {
        assertThat(formatter.formatExpression(StateBindingNode.of("count").toExpression())).isEqualTo("count");
        assertThat(formatter.formatExpression(new StateBindingNode("user", "name").toExpression()))
                .isEqualTo("user.name");
    }

    @Test
    void formatsStandaloneForest() {
        List<FrrNode> forest = List.of(
                new ImportNode(List.of(), "ferrum:core"),
                new ComponentNode("Empty", Map.of(), List.of()));

        assertThat(formatter.format(forest)).isEqualTo("import {} from \"ferrum:core\"\nEmpty()\n");
    }

    // ==============================================================
    // Helpers
    // ==============================================================

    private static String sample(String name) throws IOException {
        try (InputStream in = FrrFormatterTest.class.getResourceAsStream("/samples/" + name)) {
            assertThat(in).as("sample %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** Mismo tipo, etiqueta o nombre, texto, conjunto de atributos y número de hijos, recursivamente. */
    private static void assertSameShape(List<FrrNode> actual, List<FrrNode> expected) {
        assertThat(actual).hasSameSizeAs(expected);
        for (int i = 0; i < expected.size(); i++) {
            FrrNode a = actual.get(i);
            FrrNode e = expected.get(i);
            assertThat(a.getClass()).isEqualTo(e.getClass());

            if (e instanceof ElementNode el) {
                ElementNode other = (ElementNode) a;
                assertThat(other.tag()).isEqualTo(el.tag());
                assertThat(other.attributes()).isEqualTo(el.attributes());
            } else if (e instanceof ComponentNode c) {
                ComponentNode other = (ComponentNode) a;
                assertThat(other.name()).isEqualTo(c.name());
                assertThat(other.attributes()).isEqualTo(c.attributes());
            } else {
                assertThat(a).isEqualTo(e);
            }
            assertSameShape(a.children(), e.children());
        }
    }
}

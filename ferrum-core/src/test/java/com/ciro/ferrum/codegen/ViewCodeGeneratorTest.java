package com.ciro.ferrum.codegen;

import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.ast.TextNode;
import com.ciro.ferrum.parser.FrrParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewCodeGeneratorTest {

    private final ViewCodeGenerator generator = new ViewCodeGenerator();

    @Test
    void rendersCounterView() throws Exception {
        List<FrrNode> forest = FrrParser.parse("""
                import { create_signal } from "ferrum:state"
                div#app.container
                    h1.title "Counter"
                    Button(onclick: set_count(-1))
                        "-"
                    span
                        count
                        count.value
                    input type="number"
                """);

        assertThat(generator.toViewCode(forest)).isEqualTo("""
                view! {
                    <div id="app" class="container">
                        <h1 class="title">
                            "Counter"
                        </h1>
                        <Button onclick={set_count(-1)}>
                            "-"
                        </Button>
                        <span>
                            {read(count)}
                            {read(count.value)}
                        </span>
                        <input type="number"/>
                    </div>
                }
                """);
    }

    @Test
    void emptyElementsAndComponentsSelfClose() throws Exception {
        assertThat(generator.toViewCode(FrrParser.parse("div.spacer\nSpinner(size: 3)\n")))
                .isEqualTo("view! {\n    <div class=\"spacer\"/>\n    <Spinner size={3}/>\n}\n");
    }

    @Test
    void escapesTextLiterals() {
        assertThat(generator.toViewCode(List.of(new TextNode("say \"hi\" \\ bye"))))
                .isEqualTo("view! {\n    \"say \\\"hi\\\" \\\\ bye\"\n}\n");
    }

    @Test
    void emptyForestIsEmptyBlock() {
        assertThat(generator.toViewCode(List.of())).isEqualTo("view! {\n}\n");
    }

    @Test
    void honoursIndentWidth() throws Exception {
        assertThat(new ViewCodeGenerator(2).toViewCode(FrrParser.parse("ul\n    li \"a\"\n")))
                .isEqualTo("view! {\n  <ul>\n    <li>\n      \"a\"\n    </li>\n  </ul>\n}\n");
    }

    @Test
    void rejectsNegativeIndent() {
        assertThatThrownBy(() -> new ViewCodeGenerator(-2)).isInstanceOf(IllegalArgumentException.class);
    }
}

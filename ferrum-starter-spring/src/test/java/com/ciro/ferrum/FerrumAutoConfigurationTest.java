package com.ciro.ferrum;

import com.ciro.ferrum.codegen.HtmlGenerator;
import com.ciro.ferrum.codegen.ViewCodeGenerator;
import com.ciro.ferrum.format.FormatterOptions;
import com.ciro.ferrum.format.FrrFormatter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class FerrumAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FerrumAutoConfiguration.class));

    @Test
    void registersFrontEndBeansWithDefaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(FrrFormatter.class);
            assertThat(ctx).hasSingleBean(HtmlGenerator.class);
            assertThat(ctx).hasSingleBean(ViewCodeGenerator.class);
            assertThat(ctx).hasSingleBean(FerrumCompiler.class);

            assertThat(ctx.getBean(FrrFormatter.class).options()).isEqualTo(FormatterOptions.DEFAULT);
            assertThat(ctx.getBean(HtmlGenerator.class).options().title()).isEqualTo("Ferrum App");
            assertThat(ctx.getBean(ViewCodeGenerator.class).indentWidth()).isEqualTo(4);
        });
    }

    @Test
    void bindsFerrumProperties() {
        runner.withPropertyValues(
                        "ferrum.format.indent-width=2",
                        "ferrum.html.title=Counter",
                        "ferrum.html.lang=es",
                        "ferrum.html.root-id=app",
                        "ferrum.view.indent-width=2")
                .run(ctx -> {
                    assertThat(ctx.getBean(FrrFormatter.class).options().indentWidth()).isEqualTo(2);
                    assertThat(ctx.getBean(ViewCodeGenerator.class).indentWidth()).isEqualTo(2);

                    String html = ctx.getBean(FerrumCompiler.class).renderPage("p \"Hola\"");
                    assertThat(html)
                            .contains("<html lang='es'>")
                            .contains("<title>Counter</title>")
                            .contains("<div id='app'><p>Hola</p></div>");
                });
    }

    @Test
    void compilerUsesConfiguredFormatter() {
        runner.withPropertyValues("ferrum.format.indent-width=2")
                .run(ctx -> assertThat(ctx.getBean(FerrumCompiler.class).format("div\n    p"))
                        .isEqualTo("div\n  p\n"));
    }

    @Test
    void backsOffWhenUserDefinesOwnBean() {
        runner.withUserConfiguration(CustomFormatterConfig.class).run(ctx -> {
            assertThat(ctx).hasSingleBean(FrrFormatter.class);
            assertThat(ctx.getBean(FrrFormatter.class).options().indentChar()).isEqualTo('\t');
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomFormatterConfig {
        @Bean
        FrrFormatter customFormatter() {
            return new FrrFormatter(new FormatterOptions(1, '\t'));
        }
    }
}

package com.ciro.ferrum;

import com.ciro.ferrum.codegen.HtmlGenerator;
import com.ciro.ferrum.codegen.HtmlOptions;
import com.ciro.ferrum.codegen.Stylesheet;
import com.ciro.ferrum.codegen.ViewCodeGenerator;
import com.ciro.ferrum.format.FormatterOptions;
import com.ciro.ferrum.format.FrrFormatter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Expone el front end de Ferrum a una aplicación Spring (p. ej. un servidor de desarrollo).
 * Cada bean se puede reemplazar declarando uno propio.
 */
@AutoConfiguration
@EnableConfigurationProperties(FerrumProperties.class)
public class FerrumAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FrrFormatter frrFormatter(FerrumProperties props) {
        FerrumProperties.Format f = props.getFormat();
        return new FrrFormatter(new FormatterOptions(f.getIndentWidth(), f.getIndentChar()));
    }

    @Bean
    @ConditionalOnMissingBean
    public HtmlGenerator htmlGenerator(FerrumProperties props) {
        FerrumProperties.Html h = props.getHtml();
        return new HtmlGenerator(new HtmlOptions(h.getTitle(), h.getLang(), h.getRootId(), Stylesheet.bundled()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ViewCodeGenerator viewCodeGenerator(FerrumProperties props) {
        return new ViewCodeGenerator(props.getView().getIndentWidth());
    }

    @Bean
    @ConditionalOnMissingBean
    public FerrumCompiler ferrumCompiler(FrrFormatter formatter, HtmlGenerator htmlGenerator,
                                         ViewCodeGenerator viewCodeGenerator) {
        return new FerrumCompiler(formatter, htmlGenerator, viewCodeGenerator);
    }
}

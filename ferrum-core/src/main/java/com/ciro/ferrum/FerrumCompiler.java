package com.ciro.ferrum;

import com.ciro.ferrum.ast.FrrNode;
import com.ciro.ferrum.codegen.ForestJsonWriter;
import com.ciro.ferrum.codegen.HtmlGenerator;
import com.ciro.ferrum.codegen.ViewCodeGenerator;
import com.ciro.ferrum.format.FrrFormatException;
import com.ciro.ferrum.format.FrrFormatter;
import com.ciro.ferrum.parser.FrrParser;
import com.ciro.ferrum.parser.FrrSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Punto de entrada del front end: parse, format, toHtml y toViewCode.
 * Es lo único que necesitan el CLI o el servidor de desarrollo.
 *
 * <p>Sin estado mutable; una instancia se comparte entre hilos sin sincronizar.
 */
public final class FerrumCompiler {

    private static final Logger log = LoggerFactory.getLogger(FerrumCompiler.class);

    private final FrrFormatter formatter;
    private final HtmlGenerator htmlGenerator;
    private final ViewCodeGenerator viewCodeGenerator;
    private final ForestJsonWriter jsonWriter;

    public FerrumCompiler() {
        this(new FrrFormatter(), new HtmlGenerator(), new ViewCodeGenerator());
    }

    public FerrumCompiler(FrrFormatter formatter, HtmlGenerator htmlGenerator, ViewCodeGenerator viewCodeGenerator) {
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.htmlGenerator = Objects.requireNonNull(htmlGenerator, "htmlGenerator must not be null");
        this.viewCodeGenerator = Objects.requireNonNull(viewCodeGenerator, "viewCodeGenerator must not be null");
        this.jsonWriter = new ForestJsonWriter();
    }

    public List<FrrNode> parse(String source) throws FrrSyntaxException {
        return FrrParser.parse(source);
    }

    public String format(String source) throws FrrFormatException {
        return formatter.format(source);
    }

    public String toHtml(List<FrrNode> forest) {
        return htmlGenerator.toHtml(forest);
    }

    public String toViewCode(List<FrrNode> forest) {
        return viewCodeGenerator.toViewCode(forest);
    }

    public String toJson(List<FrrNode> forest) {
        return jsonWriter.toJson(forest);
    }

    /** Para el servidor de desarrollo: documento si compila, página de error si no. */
    public String renderPage(String source) {
        try {
            return toHtml(parse(source));
        } catch (FrrSyntaxException e) {
            log.debug("Rendering error page: {}", e.getMessage());
            return htmlGenerator.errorPage(e.getMessage());
        }
    }

    // ==============================================================
    // Archivos: lee un .frr en UTF-8 y escribe la salida generada
    // ==============================================================

    public void compileToHtml(Path input, Path output) throws IOException, FrrSyntaxException {
        String html = toHtml(parse(read(input)));
        write(output, html);
        log.debug("Compiled {} -> {} ({} chars of HTML)", input, output, html.length());
    }

    public void compileToViewCode(Path input, Path output) throws IOException, FrrSyntaxException {
        String code = toViewCode(parse(read(input)));
        write(output, code);
        log.debug("Compiled {} -> {} ({} chars of view code)", input, output, code.length());
    }

    private static String read(Path input) throws IOException {
        return Files.readString(input, StandardCharsets.UTF_8);
    }

    private static void write(Path output, String content) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(output, content, StandardCharsets.UTF_8);
    }

    public FrrFormatter formatter() {
        return formatter;
    }

    public HtmlGenerator htmlGenerator() {
        return htmlGenerator;
    }

    public ViewCodeGenerator viewCodeGenerator() {
        return viewCodeGenerator;
    }
}

package com.ciro.ferrum.codegen;

import com.helger.css.ECSSVersion;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.reader.CSSReader;
import com.helger.css.writer.CSSWriter;
import com.helger.css.writer.CSSWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Hoja de estilos que se incrusta en el {@code <style>} de cada documento generado.
 * El texto se trata como una constante opaca: se minifica una vez y no se vuelve a tocar.
 */
public final class Stylesheet {

    private static final Logger log = LoggerFactory.getLogger(Stylesheet.class);

    static final String BUNDLED_RESOURCE = "ferrum/ferrum.css";

    private static final Stylesheet NONE = new Stylesheet("");

    private final String css;

    private Stylesheet(String css) {
        this.css = css;
    }

    /** Hoja incluida en el jar, cargada y minificada una sola vez. */
    public static Stylesheet bundled() {
        return BundledHolder.INSTANCE;
    }

    /** CSS propio del usuario, minificado igual que la hoja incluida. */
    public static Stylesheet of(String css) {
        Objects.requireNonNull(css, "css must not be null");
        return new Stylesheet(minify(css));
    }

    public static Stylesheet none() {
        return NONE;
    }

    public String css() {
        return css;
    }

    public boolean isEmpty() {
        return css.isEmpty();
    }

    /**
     * Parsea con ph-css y reescribe en salida optimizada.
     * Si ph-css no entiende el CSS se devuelve el texto original.
     */
    static String minify(String css) {
        if (css.isBlank()) return "";

        CascadingStyleSheet parsed = CSSReader.readFromString(css, ECSSVersion.CSS30);
        if (parsed == null) {
            log.warn("⚠️ Stylesheet could not be parsed, inlining it unminified ({} chars)", css.length());
            return css;
        }

        CSSWriterSettings settings = new CSSWriterSettings(ECSSVersion.CSS30);
        settings.setOptimizedOutput(true);
        CSSWriter writer = new CSSWriter(settings);
        writer.setWriteHeaderText(false);
        return writer.getCSSAsString(parsed);
    }

    private static String load(String resource) {
        ClassLoader loader = Stylesheet.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled stylesheet not found on classpath: " + resource);
            }
            String raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            String minified = minify(raw);
            log.debug("Loaded {} ({} chars, {} minified)", resource, raw.length(), minified.length());
            return minified;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bundled stylesheet " + resource, e);
        }
    }

    private static final class BundledHolder {
        static final Stylesheet INSTANCE = new Stylesheet(load(BUNDLED_RESOURCE));
    }

    @Override
    public String toString() {
        return "Stylesheet[" + css.length() + " chars]";
    }
}

package com.ciro.ferrum.codegen;

import java.util.Objects;

/**
 * Datos fijos del documento HTML: título, idioma, id del contenedor raíz y hoja de estilos.
 */
public record HtmlOptions(String title, String lang, String rootId, Stylesheet stylesheet) {

    public static final String DEFAULT_TITLE = "Ferrum App";
    public static final String DEFAULT_LANG = "en";
    public static final String DEFAULT_ROOT_ID = "ferrum-app";

    public HtmlOptions {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(lang, "lang must not be null");
        Objects.requireNonNull(rootId, "rootId must not be null");
        Objects.requireNonNull(stylesheet, "stylesheet must not be null");
        if (rootId.isBlank()) {
            throw new IllegalArgumentException("rootId must not be blank");
        }
    }

    public static HtmlOptions defaults() {
        return new HtmlOptions(DEFAULT_TITLE, DEFAULT_LANG, DEFAULT_ROOT_ID, Stylesheet.bundled());
    }

    public HtmlOptions withTitle(String newTitle) {
        return new HtmlOptions(newTitle, lang, rootId, stylesheet);
    }

    public HtmlOptions withStylesheet(Stylesheet newStylesheet) {
        return new HtmlOptions(title, lang, rootId, newStylesheet);
    }
}

package com.ciro.ferrum;

import com.ciro.ferrum.codegen.HtmlOptions;
import com.ciro.ferrum.codegen.ViewCodeGenerator;
import com.ciro.ferrum.format.FormatterOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ferrum")
public class FerrumProperties {

    private final Format format = new Format();
    private final Html html = new Html();
    private final View view = new View();

    public Format getFormat() { return format; }
    public Html getHtml() { return html; }
    public View getView() { return view; }

    /** ferrum.format.* */
    public static class Format {
        /** Caracteres por nivel de anidamiento */
        private int indentWidth = FormatterOptions.DEFAULT.indentWidth();
        /** Carácter de indentación (espacio o tabulador) */
        private char indentChar = FormatterOptions.DEFAULT.indentChar();

        public int getIndentWidth() { return indentWidth; }
        public void setIndentWidth(int indentWidth) { this.indentWidth = indentWidth; }

        public char getIndentChar() { return indentChar; }
        public void setIndentChar(char indentChar) { this.indentChar = indentChar; }
    }

    /** ferrum.html.* */
    public static class Html {
        /** Contenido del {@code <title>} */
        private String title = HtmlOptions.DEFAULT_TITLE;
        /** Atributo lang del {@code <html>} */
        private String lang = HtmlOptions.DEFAULT_LANG;
        /** id del contenedor donde se monta el bosque */
        private String rootId = HtmlOptions.DEFAULT_ROOT_ID;

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getLang() { return lang; }
        public void setLang(String lang) { this.lang = lang; }

        public String getRootId() { return rootId; }
        public void setRootId(String rootId) { this.rootId = rootId; }
    }

    /** ferrum.view.* */
    public static class View {
        private int indentWidth = ViewCodeGenerator.DEFAULT_INDENT_WIDTH;

        public int getIndentWidth() { return indentWidth; }
        public void setIndentWidth(int indentWidth) { this.indentWidth = indentWidth; }
    }
}

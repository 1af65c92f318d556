package com.williamcallahan.codelab.service.markdown;

import com.vladsch.flexmark.ext.definition.DefinitionExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.ext.typographic.TypographicExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Flexmark-backed renderer configured with the codelab markdown dialect: fenced code, tables
 * (with column spans), definition lists for infoboxes and typographic punctuation.
 *
 * Raw HTML is passed through unescaped since buttons, surveys and video embeds are authored as
 * inline HTML.
 */
@Component
public class FlexmarkMarkupRenderer implements MarkupRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FlexmarkMarkupRenderer.class);

    private final Parser parser;
    private final HtmlRenderer renderer;

    public FlexmarkMarkupRenderer() {
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                DefinitionExtension.create(),
                TypographicExtension.create()
            ))
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(HtmlRenderer.ESCAPE_HTML, false)
            .set(HtmlRenderer.SUPPRESS_HTML, false)
            .set(HtmlRenderer.SOFT_BREAK, "\n")
            .set(HtmlRenderer.HARD_BREAK, "<br />\n")
            .set(HtmlRenderer.FENCED_CODE_LANGUAGE_CLASS_PREFIX, "language-")
            .set(TablesExtension.COLUMN_SPANS, true)
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true);

        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
        logger.info("FlexmarkMarkupRenderer initialized with codelab markdown extensions");
    }

    @Override
    public String render(String markdown) {
        Node document = parser.parse(markdown == null ? "" : markdown);
        String html = renderer.render(document);
        logger.debug("Rendered {} chars of markdown into {} chars of markup",
            markdown == null ? 0 : markdown.length(), html.length());
        return html;
    }
}

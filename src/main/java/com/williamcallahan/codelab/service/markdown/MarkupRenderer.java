package com.williamcallahan.codelab.service.markdown;

/**
 * Renders author markdown into XHTML-flavored markup.
 */
@FunctionalInterface
public interface MarkupRenderer {

    /**
     * Renders raw markdown.
     *
     * @param markdown preprocessed markdown text
     * @return rendered markup
     */
    String render(String markdown);
}

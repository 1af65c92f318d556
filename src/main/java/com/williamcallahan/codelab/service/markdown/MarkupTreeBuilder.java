package com.williamcallahan.codelab.service.markdown;

import org.jsoup.nodes.Document;

/**
 * Builds a navigable node tree from rendered markup.
 */
@FunctionalInterface
public interface MarkupTreeBuilder {

    /**
     * Parses rendered markup.
     *
     * @param markup rendered markup
     * @return document tree
     */
    Document buildTree(String markup);
}

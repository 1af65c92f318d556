package com.williamcallahan.codelab.service.markdown;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Builds the markup tree with jsoup's lenient HTML parser. Rendered markdown is a body fragment,
 * so leading comments stay inside the body. Pretty printing is disabled so text nodes keep their
 * original whitespace.
 */
@Component
public class JsoupMarkupTreeBuilder implements MarkupTreeBuilder {

    @Override
    public Document buildTree(String markup) {
        Document document = Jsoup.parseBodyFragment(markup == null ? "" : markup);
        document.outputSettings().prettyPrint(false);
        return document;
    }
}

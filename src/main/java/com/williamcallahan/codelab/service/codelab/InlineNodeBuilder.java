package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.node.ButtonNode;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.LinkNode;
import com.williamcallahan.codelab.domain.codelab.node.TextNode;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds text runs, links and buttons.
 */
final class InlineNodeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(InlineNodeBuilder.class);

    private static final String DOWNLOAD_PREFIX = "download ";

    private final SubtreeWalker walker;

    InlineNodeBuilder(SubtreeWalker walker) {
        this.walker = walker;
    }

    static boolean isTextOrLineBreak(Node node) {
        return HtmlNodes.isText(node) || HtmlNodes.isElement(node, "br");
    }

    static boolean isLink(Node node) {
        return HtmlNodes.isElement(node, "a");
    }

    static boolean isButton(Node node) {
        return HtmlNodes.isElement(node, "button");
    }

    /**
     * Builds a styled text run from the cursor. A cursor wrapping an anchor becomes a link.
     *
     * @param context walk state
     * @return text or link node, empty for blank content
     */
    Optional<CodelabNode> text(WalkContext context) {
        Node current = context.cursor();
        Element anchor = current instanceof Element ? HtmlNodes.findDescendant(current, "a") : null;
        if (anchor != null) {
            Optional<CodelabNode> link;
            try (CursorScope ignored = context.descend(anchor)) {
                link = link(context);
            }
            if (link.isPresent()) {
                link.get().setBlock(HtmlNodes.findBlockParent(current));
                return link;
            }
        }

        return text(context, HtmlNodes.stringify(current, false));
    }

    /**
     * Builds a text run holding {@code value}, styled and placed like the node at the cursor.
     *
     * @param context walk state
     * @param value text of the run
     * @return text node, empty for blank content
     */
    Optional<CodelabNode> text(WalkContext context, String value) {
        Node current = context.cursor();
        boolean lineBreak = HtmlNodes.isElement(current, "br");
        if (value.isEmpty() || (!lineBreak && value.isBlank())) {
            return Optional.empty();
        }
        TextNode text = new TextNode(value);
        text.setBold(HtmlNodes.isBold(current));
        text.setItalic(HtmlNodes.isItalic(current));
        text.setCode(BlockNodeBuilder.isInsideCode(current));
        text.setBlock(HtmlNodes.findBlockParent(current));
        return Optional.of(text);
    }

    /**
     * Builds a link from the anchor at the cursor. Emphasis of an enclosing element is carried
     * onto the link's text runs.
     *
     * @param context walk state
     * @return link node, empty when the target or the content is missing
     */
    Optional<CodelabNode> link(WalkContext context) {
        Node current = context.cursor();
        String href = HtmlNodes.attr(current, "href").trim();
        if (href.isEmpty()) {
            logger.debug("Dropping link without href");
            return Optional.empty();
        }

        List<CodelabNode> content;
        try (CursorScope ignored = context.descend()) {
            content = walker.parseSubtree(context);
        }
        if (content.isEmpty()) {
            return Optional.empty();
        }

        Node parent = current.parent();
        boolean outsideBold = parent != null && HtmlNodes.isBold(parent);
        boolean outsideItalic = parent != null && HtmlNodes.isItalic(parent);
        for (CodelabNode child : content) {
            if (child instanceof TextNode text) {
                text.setBold(text.isBold() || outsideBold);
                text.setItalic(text.isItalic() || outsideItalic);
            }
        }

        LinkNode link = new LinkNode(href, content);
        link.setName(HtmlNodes.attr(current, "name"));
        link.setTarget(HtmlNodes.attr(current, "target"));
        link.setBlock(HtmlNodes.findBlockParent(current));
        return Optional.of(link);
    }

    /**
     * Builds a button. A button wrapping an anchor becomes a link whose content is the button;
     * without an anchor it degrades to plain text.
     *
     * @param context walk state
     * @return link-wrapped button or text, empty for missing target or content
     */
    Optional<CodelabNode> button(WalkContext context) {
        Node current = context.cursor();
        Element anchor = HtmlNodes.findDescendant(current, "a");
        if (anchor == null) {
            return text(context);
        }
        String href = anchor.attr("href").trim();
        if (href.isEmpty()) {
            logger.debug("Dropping button without link target");
            return Optional.empty();
        }

        List<CodelabNode> content;
        try (CursorScope ignored = context.descend(anchor)) {
            content = walker.parseSubtree(context);
        }
        if (content.isEmpty()) {
            return Optional.empty();
        }

        String label = AsciiTextNormalizer.toLowerAscii(HtmlNodes.stringify(anchor, true));
        ButtonNode button = new ButtonNode(true, true, label.startsWith(DOWNLOAD_PREFIX), content);
        LinkNode link = new LinkNode(href, List.of(button));
        link.setBlock(HtmlNodes.findBlockParent(current));
        return Optional.of(link);
    }
}

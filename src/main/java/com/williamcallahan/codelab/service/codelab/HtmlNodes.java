package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.support.AsciiTextNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Set;

/**
 * Navigation and stringification helpers over the jsoup markup tree.
 */
final class HtmlNodes {

    private static final Set<String> BLOCK_PARENTS = Set.of(
        "p", "li", "dd", "dt", "td", "th", "pre", "blockquote",
        "h1", "h2", "h3", "h4", "h5", "h6"
    );
    private static final Set<String> BOLD_TAGS = Set.of("strong", "b");
    private static final Set<String> ITALIC_TAGS = Set.of("em", "i");

    private HtmlNodes() {
    }

    static Node firstChild(Node node) {
        return node.childNodeSize() == 0 ? null : node.childNode(0);
    }

    static boolean isElement(Node node, String tag) {
        return node instanceof Element element && element.normalName().equals(tag);
    }

    static boolean isElement(Node node, Set<String> tags) {
        return node instanceof Element element && tags.contains(element.normalName());
    }

    static boolean isText(Node node) {
        return node instanceof TextNode;
    }

    /**
     * Returns the value of an attribute, or an empty string when absent.
     */
    static String attr(Node node, String key) {
        return node == null ? "" : node.attr(key);
    }

    /**
     * Finds the nearest ancestor of {@code node} with the given tag, excluding the node itself.
     */
    static Element findParent(Node node, String tag) {
        for (Node parent = node.parent(); parent != null; parent = parent.parent()) {
            if (isElement(parent, tag)) {
                return (Element) parent;
            }
        }
        return null;
    }

    /**
     * Finds the first descendant element with the given tag, including the node itself.
     */
    static Element findDescendant(Node node, String tag) {
        if (isElement(node, tag)) {
            return (Element) node;
        }
        if (node instanceof Element element) {
            return element.selectFirst(tag);
        }
        return null;
    }

    /**
     * Finds the nearest enclosing block-level element: paragraph, list item, cell, heading or
     * preformatted block.
     *
     * @return block element, or null when the node sits directly in the body
     */
    static Element findBlockParent(Node node) {
        for (Node parent = node.parent(); parent != null; parent = parent.parent()) {
            if (isElement(parent, BLOCK_PARENTS)) {
                return (Element) parent;
            }
        }
        return null;
    }

    static boolean isBold(Node node) {
        return hasStyleAncestor(node, BOLD_TAGS);
    }

    static boolean isItalic(Node node) {
        return hasStyleAncestor(node, ITALIC_TAGS);
    }

    private static boolean hasStyleAncestor(Node node, Set<String> tags) {
        for (Node current = node; current != null; current = current.parent()) {
            if (isElement(current, tags)) {
                return true;
            }
            if (isElement(current, BLOCK_PARENTS)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Flattens a node into plain text. Soft line breaks inside text nodes become spaces,
     * {@code <br>} elements become newlines and typographic punctuation is folded to ASCII.
     *
     * @param node root node
     * @param trim whether to trim the result
     * @return text content
     */
    static String stringify(Node node, boolean trim) {
        String value;
        if (node instanceof TextNode textNode) {
            value = textNode.getWholeText().replace('\n', ' ');
        } else if (isElement(node, "br")) {
            value = trim ? "" : "\n";
        } else {
            StringBuilder text = new StringBuilder();
            for (Node child : node.childNodes()) {
                if (isElement(child, "br")) {
                    text.append('\n');
                } else if (child instanceof TextNode childText) {
                    text.append(childText.getWholeText());
                } else {
                    text.append(stringify(child, false));
                }
            }
            value = text.toString();
        }
        value = AsciiTextNormalizer.cleanTypography(value);
        return trim ? value.trim() : value;
    }

    /**
     * Flattens a node into text keeping every line break, for line-oriented parsing.
     *
     * @param node root node
     * @return text with original newlines
     */
    static String lines(Node node) {
        if (node instanceof TextNode textNode) {
            return AsciiTextNormalizer.cleanTypography(textNode.getWholeText());
        }
        if (isElement(node, "br")) {
            return "\n";
        }
        StringBuilder text = new StringBuilder();
        for (Node child : node.childNodes()) {
            text.append(lines(child));
        }
        return text.toString();
    }
}

package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.node.CodeNode;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.HeaderNode;
import com.williamcallahan.codelab.domain.codelab.node.ItemsListNode;
import com.williamcallahan.codelab.domain.codelab.node.NodeKind;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds headings, lists and code blocks.
 */
final class BlockNodeBuilder {

    private static final Map<String, Integer> HEADER_LEVELS = Map.of(
        "h1", 1, "h2", 2, "h3", 3, "h4", 4, "h5", 5, "h6", 6
    );
    private static final Set<String> LIST_TAGS = Set.of("ul", "ol");

    private static final String HEADER_LEARN = "what you'll learn";
    private static final String HEADER_COVERED = "what we've covered";
    private static final String HEADER_FAQ = "frequently asked questions";

    private static final String LANGUAGE_CLASS_PREFIX = "language-";

    private final SubtreeWalker walker;
    private final InlineNodeBuilder inline;
    private final Set<String> consoleClasses;

    BlockNodeBuilder(SubtreeWalker walker, InlineNodeBuilder inline, List<String> consoleLanguages) {
        this.walker = walker;
        this.inline = inline;
        Set<String> classes = new HashSet<>();
        for (String language : consoleLanguages) {
            classes.add(LANGUAGE_CLASS_PREFIX + AsciiTextNormalizer.toLowerAscii(language).trim());
        }
        this.consoleClasses = Set.copyOf(classes);
    }

    static boolean isHeader(Node node) {
        return HtmlNodes.isElement(node, HEADER_LEVELS.keySet());
    }

    static boolean isList(Node node) {
        return HtmlNodes.isElement(node, LIST_TAGS);
    }

    static boolean isCode(Node node) {
        return HtmlNodes.isElement(node, "code");
    }

    boolean isConsole(Node node) {
        if (!isCode(node)) {
            return false;
        }
        for (String className : ((Element) node).classNames()) {
            if (consoleClasses.contains(AsciiTextNormalizer.toLowerAscii(className))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reports whether a node is, or sits inside, an inline code span of its block.
     */
    static boolean isInsideCode(Node node) {
        Element block = HtmlNodes.findBlockParent(node);
        for (Node current = node; current != null && current != block; current = current.parent()) {
            if (isCode(current)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Builds a heading. A heading always clears the active environments, and the well-known
     * learning and FAQ headings become checklist and FAQ headings.
     *
     * @param context walk state
     * @return heading, empty when it has no content
     */
    Optional<CodelabNode> header(WalkContext context) {
        Element heading = (Element) context.cursor();
        List<CodelabNode> content;
        try (CursorScope ignored = context.descend()) {
            content = walker.parseSubtree(context);
        }
        if (content.isEmpty()) {
            return Optional.empty();
        }
        HeaderNode header = new HeaderNode(HEADER_LEVELS.get(heading.normalName()), content);
        String title = AsciiTextNormalizer.toLowerAscii(HtmlNodes.stringify(heading, true));
        switch (title) {
            case HEADER_LEARN, HEADER_COVERED -> header.markChecklist();
            case HEADER_FAQ -> header.markFaq();
            default -> {
            }
        }
        context.clearEnvironments();
        return Optional.of(header);
    }

    /**
     * Builds an ordered or unordered list. A list directly following a checklist or FAQ heading
     * takes that heading's flavor.
     *
     * @param context walk state
     * @return list, empty when no item has content
     */
    Optional<CodelabNode> list(WalkContext context) {
        Element listElement = (Element) context.cursor();
        boolean ordered = listElement.normalName().equals("ol");
        String type = listElement.attr("type");
        if (ordered && type.isEmpty()) {
            type = "1";
        }
        ItemsListNode list = new ItemsListNode(ordered, type, parseStart(listElement.attr("start")));

        for (Element item : listElement.children()) {
            if (!item.normalName().equals("li")) {
                continue;
            }
            List<CodelabNode> content;
            try (CursorScope ignored = context.descend(item)) {
                content = NodePostProcessor.compact(walker.parseSubtree(context));
            }
            if (!content.isEmpty()) {
                list.addItem(content);
            }
        }
        if (list.isEmpty()) {
            return Optional.empty();
        }

        CodelabNode previous = context.lastNode();
        if (previous != null) {
            if (previous.getKind() == NodeKind.HEADER_CHECKLIST) {
                list.markChecklist();
            } else if (previous.getKind() == NodeKind.HEADER_FAQ) {
                list.markFaq();
            }
        }
        return Optional.of(list);
    }

    /**
     * Builds a code fragment. Code outside a preformatted block is inline text.
     *
     * @param context walk state
     * @param terminal whether the block is a console session
     * @return code fragment or inline text, empty for an empty fragment among siblings
     */
    Optional<CodelabNode> code(WalkContext context, boolean terminal) {
        Node current = context.cursor();
        Element pre = HtmlNodes.findParent(current, "pre");
        if (pre == null) {
            return inline.text(context);
        }

        String value = HtmlNodes.lines(current);
        Node parent = current.parent();
        if (value.isEmpty()) {
            if (parent != null && parent.childNodeSize() > 1) {
                return Optional.empty();
            }
            value = "\n";
        } else if (parent != null && HtmlNodes.firstChild(parent) == current
                && !HtmlNodes.isElement(parent, "span")) {
            value = "\n" + value;
        }

        CodeNode code = new CodeNode(value, terminal, terminal ? "" : language(current));
        code.setBlock(pre);
        return Optional.of(code);
    }

    private static String language(Node node) {
        if (!(node instanceof Element element)) {
            return "";
        }
        List<String> languages = new ArrayList<>();
        for (String className : element.classNames()) {
            if (className.startsWith(LANGUAGE_CLASS_PREFIX) && className.length() > LANGUAGE_CLASS_PREFIX.length()) {
                languages.add(className.substring(LANGUAGE_CLASS_PREFIX.length()));
            }
        }
        return languages.isEmpty() ? "" : languages.get(0);
    }

    private static int parseStart(String start) {
        try {
            return Integer.parseInt(start.trim());
        } catch (NumberFormatException notDeclared) {
            return 0;
        }
    }
}

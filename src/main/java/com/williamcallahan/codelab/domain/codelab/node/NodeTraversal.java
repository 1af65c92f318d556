package com.williamcallahan.codelab.domain.codelab.node;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Kind-exhaustive traversal over nested content nodes.
 */
public final class NodeTraversal {

    private NodeTraversal() {
    }

    /**
     * Returns the nodes directly nested in {@code node}, in document order.
     *
     * @param node parent node
     * @return nested nodes, empty for leaf kinds
     */
    public static List<CodelabNode> children(CodelabNode node) {
        return switch (node.getKind()) {
            case TEXT, CODE, IMAGE, YOUTUBE, IFRAME, SURVEY, IMPORT -> List.of();
            case LINK -> ((LinkNode) node).getContent();
            case BUTTON -> ((ButtonNode) node).getContent();
            case HEADER, HEADER_CHECKLIST, HEADER_FAQ -> ((HeaderNode) node).getContent();
            case ITEMS_LIST, ITEMS_CHECKLIST, ITEMS_FAQ ->
                ((ItemsListNode) node).getItems().stream().flatMap(List::stream).toList();
            case INFOBOX -> ((InfoboxNode) node).getContent();
            case GRID -> ((GridNode) node).getRows().stream()
                .flatMap(List::stream)
                .flatMap(cell -> cell.content().stream())
                .toList();
            case BLOCK -> ((BlockNode) node).getContent();
        };
    }

    /**
     * Collects every node, at any depth, that matches {@code filter}.
     *
     * @param nodes top-level nodes
     * @param filter selection predicate
     * @return matching nodes in document order
     */
    public static List<CodelabNode> collect(List<CodelabNode> nodes, Predicate<CodelabNode> filter) {
        List<CodelabNode> matches = new ArrayList<>();
        for (CodelabNode node : nodes) {
            if (filter.test(node)) {
                matches.add(node);
            }
            matches.addAll(collect(children(node), filter));
        }
        return matches;
    }

    /**
     * Collects every import reference, at any depth.
     *
     * @param nodes top-level nodes
     * @return import nodes in document order
     */
    public static List<ImportNode> imports(List<CodelabNode> nodes) {
        return collect(nodes, node -> node.getKind() == NodeKind.IMPORT).stream()
            .map(ImportNode.class::cast)
            .toList();
    }
}

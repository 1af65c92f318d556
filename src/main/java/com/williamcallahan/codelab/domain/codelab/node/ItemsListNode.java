package com.williamcallahan.codelab.domain.codelab.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered or unordered list. Each item is its own sequence of nodes.
 */
public final class ItemsListNode extends CodelabNode {

    private final boolean ordered;
    private final String listType;
    private final int start;
    private final List<List<CodelabNode>> items = new ArrayList<>();

    /**
     * Creates a list.
     *
     * @param ordered whether items are numbered
     * @param listType numbering style ("1", "a", "i"...) or bullet style, may be empty
     * @param start first number of an ordered list, 0 when not declared
     */
    public ItemsListNode(boolean ordered, String listType, int start) {
        super(NodeKind.ITEMS_LIST);
        this.ordered = ordered;
        this.listType = listType == null ? "" : listType;
        this.start = start;
    }

    public String getListType() {
        return listType;
    }

    public int getStart() {
        return start;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public List<List<CodelabNode>> getItems() {
        return Collections.unmodifiableList(items);
    }

    public void addItem(List<CodelabNode> item) {
        requireMutable();
        items.add(List.copyOf(item));
    }

    public void markChecklist() {
        requireMutable();
        changeKind(NodeKind.ITEMS_CHECKLIST);
    }

    public void markFaq() {
        requireMutable();
        changeKind(NodeKind.ITEMS_FAQ);
    }

    @Override
    public boolean isEmpty() {
        return items.isEmpty();
    }
}

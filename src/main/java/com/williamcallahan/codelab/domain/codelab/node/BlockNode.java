package com.williamcallahan.codelab.domain.codelab.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups sibling fragments that came from the same source block (a paragraph, a list item, a
 * table cell) into one unit. A block itself belongs to no outer block.
 */
public final class BlockNode extends CodelabNode {

    private final List<CodelabNode> content;

    public BlockNode(List<CodelabNode> content) {
        super(NodeKind.BLOCK);
        this.content = new ArrayList<>(content);
        for (CodelabNode child : content) {
            addEnvironments(child.getEnvironments());
        }
    }

    public List<CodelabNode> getContent() {
        return Collections.unmodifiableList(content);
    }

    /**
     * Replaces the grouped content, used when the group is compacted.
     *
     * @param compacted new content
     */
    public void replaceContent(List<CodelabNode> compacted) {
        requireMutable();
        content.clear();
        content.addAll(compacted);
    }

    @Override
    public boolean isEmpty() {
        return content.isEmpty();
    }
}

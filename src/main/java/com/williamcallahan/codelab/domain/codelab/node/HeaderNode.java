package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;

/**
 * A heading inside a step. Checklist and FAQ headers change how the list right after them is
 * classified.
 */
public final class HeaderNode extends CodelabNode {

    private final int level;
    private final List<CodelabNode> content;

    public HeaderNode(int level, List<CodelabNode> content) {
        super(NodeKind.HEADER);
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Header level must be between 1 and 6");
        }
        this.level = level;
        this.content = List.copyOf(content);
    }

    public int getLevel() {
        return level;
    }

    public List<CodelabNode> getContent() {
        return content;
    }

    public void markChecklist() {
        requireMutable();
        changeKind(NodeKind.HEADER_CHECKLIST);
    }

    public void markFaq() {
        requireMutable();
        changeKind(NodeKind.HEADER_FAQ);
    }

    @Override
    public boolean isEmpty() {
        return content.isEmpty();
    }
}

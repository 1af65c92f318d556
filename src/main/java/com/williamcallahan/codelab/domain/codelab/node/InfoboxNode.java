package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;
import java.util.Objects;

/**
 * A highlighted aside, either positive (tip) or negative (warning).
 */
public final class InfoboxNode extends CodelabNode {

    private final InfoboxKind infoboxKind;
    private final List<CodelabNode> content;

    public InfoboxNode(InfoboxKind infoboxKind, List<CodelabNode> content) {
        super(NodeKind.INFOBOX);
        this.infoboxKind = Objects.requireNonNull(infoboxKind, "Infobox kind cannot be null");
        this.content = List.copyOf(content);
    }

    public InfoboxKind getInfoboxKind() {
        return infoboxKind;
    }

    public List<CodelabNode> getContent() {
        return content;
    }

    @Override
    public boolean isEmpty() {
        return content.isEmpty();
    }
}

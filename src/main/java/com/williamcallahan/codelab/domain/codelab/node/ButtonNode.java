package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;

/**
 * A call-to-action button. Buttons are always wrapped in a {@link LinkNode}.
 */
public final class ButtonNode extends CodelabNode {

    private final boolean raised;
    private final boolean colored;
    private final boolean download;
    private final List<CodelabNode> content;

    public ButtonNode(boolean raised, boolean colored, boolean download, List<CodelabNode> content) {
        super(NodeKind.BUTTON);
        this.raised = raised;
        this.colored = colored;
        this.download = download;
        this.content = List.copyOf(content);
    }

    public boolean isRaised() {
        return raised;
    }

    public boolean isColored() {
        return colored;
    }

    public boolean isDownload() {
        return download;
    }

    public List<CodelabNode> getContent() {
        return content;
    }

    @Override
    public boolean isEmpty() {
        return content.isEmpty();
    }
}

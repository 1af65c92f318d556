package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;
import java.util.Objects;

/**
 * A hyperlink wrapping inline content.
 */
public final class LinkNode extends CodelabNode {

    private final String url;
    private final List<CodelabNode> content;
    private String name = "";
    private String target = "";

    public LinkNode(String url, List<CodelabNode> content) {
        super(NodeKind.LINK);
        this.url = Objects.requireNonNull(url, "Link URL cannot be null");
        this.content = List.copyOf(content);
    }

    public String getUrl() {
        return url;
    }

    public List<CodelabNode> getContent() {
        return content;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        requireMutable();
        this.name = name == null ? "" : name;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        requireMutable();
        this.target = target == null ? "" : target;
    }

    @Override
    public boolean isEmpty() {
        return content.isEmpty() || content.stream().allMatch(CodelabNode::isEmpty);
    }
}

package com.williamcallahan.codelab.domain.codelab.node;

import java.util.Objects;

/**
 * An image referenced by source URL.
 */
public final class ImageNode extends CodelabNode {

    private final String src;
    private String alt = "";
    private String title = "";
    private Float width;

    public ImageNode(String src) {
        super(NodeKind.IMAGE);
        this.src = Objects.requireNonNull(src, "Image source cannot be null");
    }

    public String getSrc() {
        return src;
    }

    public String getAlt() {
        return alt;
    }

    public void setAlt(String alt) {
        requireMutable();
        this.alt = alt == null ? "" : alt;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        requireMutable();
        this.title = title == null ? "" : title;
    }

    /**
     * Returns the declared display width, or null when the markup did not set one.
     *
     * @return width in pixels
     */
    public Float getWidth() {
        return width;
    }

    public void setWidth(Float width) {
        requireMutable();
        this.width = width;
    }

    @Override
    public boolean isEmpty() {
        return src.isEmpty();
    }
}

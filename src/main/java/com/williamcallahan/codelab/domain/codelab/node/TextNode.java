package com.williamcallahan.codelab.domain.codelab.node;

import java.util.Objects;

/**
 * A run of inline text sharing one style.
 */
public final class TextNode extends CodelabNode {

    private String value;
    private boolean bold;
    private boolean italic;
    private boolean code;

    public TextNode(String value) {
        super(NodeKind.TEXT);
        this.value = Objects.requireNonNull(value, "Text value cannot be null");
    }

    public String getValue() {
        return value;
    }

    public boolean isBold() {
        return bold;
    }

    public void setBold(boolean bold) {
        requireMutable();
        this.bold = bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public void setItalic(boolean italic) {
        requireMutable();
        this.italic = italic;
    }

    public boolean isCode() {
        return code;
    }

    public void setCode(boolean code) {
        requireMutable();
        this.code = code;
    }

    /**
     * Appends the value of a compatible text run to this one.
     *
     * @param other text run with the same style
     */
    public void append(TextNode other) {
        requireMutable();
        this.value = this.value + other.value;
    }

    /**
     * Reports whether two runs can be merged into one: same styling, same block and same tags.
     *
     * @param other candidate run
     * @return true if {@code other} may be appended to this run
     */
    public boolean sameStyleAs(TextNode other) {
        return bold == other.bold
            && italic == other.italic
            && code == other.code
            && getBlock() == other.getBlock()
            && getEnvironments().equals(other.getEnvironments());
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }
}

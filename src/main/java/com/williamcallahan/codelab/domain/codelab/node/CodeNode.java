package com.williamcallahan.codelab.domain.codelab.node;

import java.util.Objects;

/**
 * A preformatted code block, optionally flagged as terminal output.
 */
public final class CodeNode extends CodelabNode {

    private String value;
    private final boolean terminal;
    private final String language;

    public CodeNode(String value, boolean terminal, String language) {
        super(NodeKind.CODE);
        this.value = Objects.requireNonNull(value, "Code value cannot be null");
        this.terminal = terminal;
        this.language = language == null ? "" : language;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public String getLanguage() {
        return language;
    }

    /**
     * Appends a fragment of the same code block.
     *
     * @param other fragment to append
     */
    public void append(CodeNode other) {
        requireMutable();
        this.value = this.value + other.value;
    }

    /**
     * Reports whether {@code other} is a continuation of the same code block.
     *
     * @param other candidate fragment
     * @return true when both fragments may be merged
     */
    public boolean continuedBy(CodeNode other) {
        return terminal == other.terminal
            && language.equals(other.language)
            && getBlock() != null
            && getBlock() == other.getBlock()
            && getEnvironments().equals(other.getEnvironments());
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }
}

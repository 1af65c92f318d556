package com.williamcallahan.codelab.domain.codelab.node;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Base type of every content node in a codelab step.
 *
 * <p>Each node carries its kind, an opaque block identity used to group sibling fragments into
 * block units, and the set of environment tags it applies to. A node starts a new block when its
 * block identity differs from the identity of the node emitted before it.</p>
 */
@JsonPropertyOrder({"kind", "environments"})
public abstract sealed class CodelabNode
        permits TextNode, CodeNode, LinkNode, ButtonNode, ImageNode, YouTubeNode, IframeNode,
                HeaderNode, ItemsListNode, InfoboxNode, GridNode, SurveyNode, ImportNode, BlockNode {

    private NodeKind kind;
    private Object block;
    private final SortedSet<String> environments = new TreeSet<>();
    private boolean frozen;

    protected CodelabNode(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
    }

    public NodeKind getKind() {
        return kind;
    }

    protected void changeKind(NodeKind newKind) {
        requireMutable();
        this.kind = Objects.requireNonNull(newKind, "Node kind cannot be null");
    }

    /**
     * Returns the block identity this node belongs to, or null for self-standing nodes.
     *
     * @return opaque block identity
     */
    @JsonIgnore
    public Object getBlock() {
        return block;
    }

    public void setBlock(Object block) {
        requireMutable();
        this.block = block;
    }

    /**
     * Reports whether this node opens a new block unit when it follows {@code previous}.
     *
     * @param previous node emitted right before this one, may be null
     * @return true if this node begins a block
     */
    public boolean startsBlockAfter(CodelabNode previous) {
        if (block == null) {
            return false;
        }
        return previous == null || previous.block != block;
    }

    public SortedSet<String> getEnvironments() {
        return Collections.unmodifiableSortedSet(environments);
    }

    /**
     * Merges environment tags into this node. Tags are trimmed and case-folded.
     *
     * @param tags tags to add
     */
    public void addEnvironments(Collection<String> tags) {
        requireMutable();
        if (tags == null) {
            return;
        }
        for (String tag : tags) {
            String normalized = AsciiTextNormalizer.toLowerAscii(tag).trim();
            if (!normalized.isEmpty()) {
                environments.add(normalized);
            }
        }
    }

    /**
     * Replaces the environment tags of this node.
     *
     * @param tags new tag set
     */
    public void replaceEnvironments(Collection<String> tags) {
        requireMutable();
        environments.clear();
        addEnvironments(tags);
    }

    @JsonIgnore
    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Rejects further mutation of this node and of every node nested in it.
     */
    public void freeze() {
        frozen = true;
        for (CodelabNode child : NodeTraversal.children(this)) {
            child.freeze();
        }
    }

    protected final void requireMutable() {
        if (frozen) {
            throw new IllegalStateException(kind + " node is finalized");
        }
    }

    /**
     * Reports whether this node renders to nothing.
     *
     * @return true when the node has no content
     */
    @JsonIgnore
    public abstract boolean isEmpty();
}

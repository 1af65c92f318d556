package com.williamcallahan.codelab.domain.codelab;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One codelab section, opened by a level-2 heading.
 */
public class Step {

    private final String title;
    private final List<CodelabNode> content = new ArrayList<>();
    private final SortedSet<String> tags = new TreeSet<>();
    private int durationMinutes;
    private boolean frozen;

    public Step(String title) {
        this.title = Objects.requireNonNull(title, "Step title cannot be null");
    }

    public String getTitle() {
        return title;
    }

    /**
     * Returns the title as a URL anchor.
     *
     * @return slug of the title
     */
    public String getSlug() {
        return AsciiTextNormalizer.slugify(title);
    }

    public List<CodelabNode> getContent() {
        return Collections.unmodifiableList(content);
    }

    public SortedSet<String> getTags() {
        return Collections.unmodifiableSortedSet(tags);
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(int durationMinutes) {
        requireMutable();
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("Step duration must be non-negative");
        }
        this.durationMinutes = durationMinutes;
    }

    public void append(CodelabNode node) {
        requireMutable();
        content.add(Objects.requireNonNull(node, "Step node cannot be null"));
    }

    /**
     * Replaces the step content with its post-processed form.
     *
     * @param nodes processed content
     */
    public void replaceContent(List<CodelabNode> nodes) {
        requireMutable();
        content.clear();
        content.addAll(nodes);
    }

    /**
     * Adds tags, case-folded. The set stays sorted and free of duplicates.
     *
     * @param newTags tags to add
     */
    public void addTags(Collection<String> newTags) {
        requireMutable();
        for (String tag : newTags) {
            String normalized = AsciiTextNormalizer.toLowerAscii(tag).trim();
            if (!normalized.isEmpty()) {
                tags.add(normalized);
            }
        }
    }

    @JsonIgnore
    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Rejects any further mutation of this step and of its content nodes.
     */
    public void freeze() {
        for (CodelabNode node : content) {
            node.freeze();
        }
        frozen = true;
    }

    private void requireMutable() {
        if (frozen) {
            throw new IllegalStateException("Step '" + title + "' is finalized");
        }
    }
}

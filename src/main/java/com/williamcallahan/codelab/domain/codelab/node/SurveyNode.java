package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;
import java.util.Objects;

/**
 * An inline survey with one or more option groups.
 */
public final class SurveyNode extends CodelabNode {

    private final String id;
    private final List<SurveyGroup> groups;

    public SurveyNode(String id, List<SurveyGroup> groups) {
        super(NodeKind.SURVEY);
        this.id = Objects.requireNonNull(id, "Survey id cannot be null");
        this.groups = List.copyOf(groups);
    }

    public String getId() {
        return id;
    }

    public List<SurveyGroup> getGroups() {
        return groups;
    }

    @Override
    public boolean isEmpty() {
        return groups.isEmpty();
    }
}

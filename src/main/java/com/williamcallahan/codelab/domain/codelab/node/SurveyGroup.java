package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;
import java.util.Objects;

/**
 * A named survey question and its answer options.
 *
 * @param name question text
 * @param options answer values in document order
 */
public record SurveyGroup(String name, List<String> options) {

    public SurveyGroup {
        Objects.requireNonNull(name, "Survey group name cannot be null");
        Objects.requireNonNull(options, "Survey options cannot be null");
        options = List.copyOf(options);
    }
}

package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.domain.codelab.Step;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import org.jsoup.nodes.Node;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Traversal state of one parse. Created fresh per document and never shared.
 */
final class WalkContext {

    private final Codelab codelab;
    private final ParseOptions options;
    private final List<Node> savedCursors = new ArrayList<>();
    private Duration totalDuration = Duration.ZERO;
    private int surveyCount;
    private Step step;
    private CodelabNode lastNode;
    private List<String> environments = List.of();
    private Node cursor;

    WalkContext(Codelab codelab, ParseOptions options) {
        this.codelab = Objects.requireNonNull(codelab, "Codelab cannot be null");
        this.options = Objects.requireNonNull(options, "Parse options cannot be null");
    }

    Codelab codelab() {
        return codelab;
    }

    ParseOptions options() {
        return options;
    }

    Node cursor() {
        return cursor;
    }

    void moveTo(Node node) {
        this.cursor = node;
    }

    /**
     * Saves the current cursor and moves it to {@code target}. Closing the returned scope restores
     * the saved cursor, on every exit path.
     *
     * @param target node to descend into
     * @return scope restoring the previous cursor
     */
    CursorScope descend(Node target) {
        savedCursors.add(cursor);
        cursor = target;
        int depth = savedCursors.size();
        return () -> {
            if (savedCursors.size() == depth) {
                cursor = savedCursors.remove(depth - 1);
            }
        };
    }

    /**
     * Saves the current cursor without moving it.
     */
    CursorScope descend() {
        return descend(cursor);
    }

    Step step() {
        return step;
    }

    void step(Step activeStep) {
        this.step = activeStep;
    }

    CodelabNode lastNode() {
        return lastNode;
    }

    List<String> environments() {
        return environments;
    }

    void environments(List<String> tags) {
        this.environments = List.copyOf(tags);
    }

    void clearEnvironments() {
        this.environments = List.of();
    }

    Duration totalDuration() {
        return totalDuration;
    }

    void addDuration(Duration duration) {
        totalDuration = StepDurations.saturatedSum(totalDuration, duration);
    }

    /**
     * Allocates the next survey identifier of this document.
     *
     * @return {@code <codelab id>-<n>}
     */
    String nextSurveyId() {
        surveyCount++;
        return codelab.getId() + "-" + surveyCount;
    }

    /**
     * Appends nodes to the active step, tagging them with the active environments.
     *
     * @param nodes nodes to append
     */
    void append(List<CodelabNode> nodes) {
        if (step == null || nodes.isEmpty()) {
            return;
        }
        for (CodelabNode node : nodes) {
            if (!environments.isEmpty()) {
                node.addEnvironments(environments);
            }
            step.append(node);
        }
        lastNode = nodes.get(nodes.size() - 1);
    }
}

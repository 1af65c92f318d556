package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.Step;
import com.williamcallahan.codelab.domain.codelab.node.BlockNode;
import com.williamcallahan.codelab.domain.codelab.node.CodeNode;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups flat node sequences into block units and compacts them. Both passes are idempotent.
 */
public final class NodePostProcessor {

    private NodePostProcessor() {
    }

    /**
     * Groups consecutive nodes that share a block identity into {@link BlockNode}s. A node opens a
     * new group whenever {@link CodelabNode#startsBlockAfter} says so; self-standing nodes (no
     * block identity) pass through unchanged.
     *
     * @param nodes flat sequence
     * @return grouped sequence
     */
    public static List<CodelabNode> groupBlocks(List<CodelabNode> nodes) {
        List<CodelabNode> grouped = new ArrayList<>(nodes.size());
        List<CodelabNode> current = new ArrayList<>();
        CodelabNode previous = null;
        for (CodelabNode node : nodes) {
            if (node.getBlock() == null) {
                flush(current, grouped);
                grouped.add(node);
            } else {
                if (node.startsBlockAfter(previous)) {
                    flush(current, grouped);
                }
                current.add(node);
            }
            previous = node;
        }
        flush(current, grouped);
        return grouped;
    }

    private static void flush(List<CodelabNode> current, List<CodelabNode> grouped) {
        if (current.isEmpty()) {
            return;
        }
        grouped.add(new BlockNode(current));
        current.clear();
    }

    /**
     * Removes empty nodes and merges adjacent compatible fragments: text runs with identical
     * styling, and fragments of the same code block.
     *
     * @param nodes sequence to compact
     * @return compacted sequence
     */
    public static List<CodelabNode> compact(List<CodelabNode> nodes) {
        List<CodelabNode> compacted = new ArrayList<>(nodes.size());
        CodelabNode previous = null;
        for (CodelabNode node : nodes) {
            if (node instanceof BlockNode block) {
                block.replaceContent(compact(block.getContent()));
            }
            if (node.isEmpty()) {
                continue;
            }
            if (previous instanceof TextNode previousText
                    && node instanceof TextNode text
                    && previousText.sameStyleAs(text)) {
                previousText.append(text);
                continue;
            }
            if (previous instanceof CodeNode previousCode
                    && node instanceof CodeNode code
                    && previousCode.continuedBy(code)) {
                previousCode.append(code);
                continue;
            }
            compacted.add(node);
            previous = node;
        }
        return compacted;
    }

    /**
     * Groups then compacts a nested content region.
     *
     * @param nodes raw region nodes
     * @return processed region
     */
    public static List<CodelabNode> process(List<CodelabNode> nodes) {
        return compact(groupBlocks(nodes));
    }

    /**
     * Finalizes a step: block-groups and compacts its content. Its tag set is already
     * deduplicated, case-folded and sorted by construction.
     *
     * @param step step to finalize, may be null
     */
    static void finalizeStep(Step step) {
        if (step == null) {
            return;
        }
        step.replaceContent(process(step.getContent()));
    }
}

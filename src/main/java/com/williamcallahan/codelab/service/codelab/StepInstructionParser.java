package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.Step;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Interprets inline {@code key: value} step instructions ({@code Duration: 1:30},
 * {@code Environment: web, ios}). Instructions mutate walk state and produce no content; prose
 * following them in the same text run is handed back to the caller.
 */
final class StepInstructionParser {

    private static final Logger logger = LoggerFactory.getLogger(StepInstructionParser.class);

    static final String DURATION = "duration";
    static final String ENVIRONMENT = "environment";

    private static final Pattern INSTRUCTION = Pattern.compile("(?i)^\\s*(duration|environment)\\s*:.*", Pattern.DOTALL);
    private static final Pattern INSTRUCTION_LINE = Pattern.compile("(?i)^\\s*(duration|environment)\\s*:.*");

    /**
     * Reports whether a tree node is the text of a step instruction.
     *
     * @param node tree node
     * @return true for text nodes starting with a known instruction key
     */
    boolean isInstruction(Node node) {
        if (!HtmlNodes.isText(node)) {
            return false;
        }
        return INSTRUCTION.matcher(HtmlNodes.lines(node)).matches();
    }

    /**
     * Consumes the instruction at the cursor together with any instruction fragments directly
     * following it, leaving the cursor on the last consumed node. Only the leading run of
     * instruction lines is interpreted.
     *
     * @param context walk state
     * @return text after the last instruction line, empty when the run holds only instructions
     */
    String apply(WalkContext context) {
        StringBuilder text = new StringBuilder(HtmlNodes.lines(context.cursor()));
        Node next = context.cursor().nextSibling();
        while (next != null && isInstruction(next)) {
            text.append('\n').append(HtmlNodes.lines(next));
            context.moveTo(next);
            next = next.nextSibling();
        }
        String[] lines = text.toString().split("\n", -1);
        int index = 0;
        while (index < lines.length && INSTRUCTION_LINE.matcher(lines[index]).matches()) {
            applyLine(context, lines[index]);
            index++;
        }
        return String.join(" ", Arrays.asList(lines).subList(index, lines.length));
    }

    private void applyLine(WalkContext context, String line) {
        int separator = line.indexOf(':');
        if (separator < 0) {
            return;
        }
        String key = AsciiTextNormalizer.toLowerAscii(line.substring(0, separator)).trim();
        String value = line.substring(separator + 1).trim();
        switch (key) {
            case DURATION -> applyDuration(context, value);
            case ENVIRONMENT -> applyEnvironment(context, value);
            default -> logger.debug("Ignoring unknown step instruction '{}'", key);
        }
    }

    private void applyDuration(WalkContext context, String value) {
        Step step = context.step();
        if (step == null) {
            return;
        }
        Duration rounded = StepDurations.roundUp(StepDurations.parse(value));
        step.setDurationMinutes(StepDurations.wholeMinutes(rounded));
        context.addDuration(rounded);
    }

    private void applyEnvironment(WalkContext context, String value) {
        List<String> tags = AsciiTextNormalizer.splitList(value);
        context.environments(tags);
        if (context.step() != null) {
            context.step().addTags(tags);
        }
        context.codelab().addTags(tags);
        CodelabNode last = context.lastNode();
        if (last != null && last.getKind().isHeader()) {
            last.replaceEnvironments(tags);
        }
    }
}

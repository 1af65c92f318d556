package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.domain.codelab.Step;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.NodeTraversal;
import com.williamcallahan.codelab.service.markdown.ImportDirectivePreprocessor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks a rendered markup tree into the codelab document model.
 *
 * <p>The walk is a single forward pass over the body: the first level-1 heading is the title,
 * the first paragraph before an id is known is the metadata block, every level-2 heading opens
 * a step and everything else is content of the current step. Nodes the walker does not
 * recognize are transparent: their children are walked instead.</p>
 */
public final class DocumentWalker implements SubtreeWalker {

    private static final Logger logger = LoggerFactory.getLogger(DocumentWalker.class);

    static final String FRAGMENT_STEP_TITLE = "fragment";

    private final StepInstructionParser instructions = new StepInstructionParser();
    private final MetadataParser metadata = new MetadataParser();
    private final InlineNodeBuilder inline;
    private final EmbedNodeBuilder embeds;
    private final BlockNodeBuilder blocks;
    private final ContainerNodeBuilder containers;

    /**
     * Creates a walker.
     *
     * @param iframeAllowlist domains whose URLs may be embedded as frames
     * @param consoleLanguages code languages rendered as console sessions
     * @param importDirectives recognizer of import placeholders
     */
    public DocumentWalker(List<String> iframeAllowlist, List<String> consoleLanguages,
                          ImportDirectivePreprocessor importDirectives) {
        Objects.requireNonNull(importDirectives, "Import directive preprocessor cannot be null");
        this.inline = new InlineNodeBuilder(this);
        this.embeds = new EmbedNodeBuilder(List.copyOf(iframeAllowlist), importDirectives);
        this.blocks = new BlockNodeBuilder(this, inline, List.copyOf(consoleLanguages));
        this.containers = new ContainerNodeBuilder(this);
    }

    /**
     * Walks a full codelab document.
     *
     * @param document rendered markup tree
     * @param options metadata pass-through options
     * @return the frozen codelab
     * @throws CodelabParseException when the tree has no body or the metadata has no id
     */
    public Codelab walkDocument(Document document, ParseOptions options) {
        Element body = requireBody(document);
        Codelab codelab = new Codelab();
        WalkContext context = new WalkContext(codelab, options);

        for (context.moveTo(HtmlNodes.firstChild(body)); context.cursor() != null;
                context.moveTo(context.cursor().nextSibling())) {
            Node current = context.cursor();
            if (HtmlNodes.isElement(current, "h1") && codelab.getTitle().isEmpty()) {
                String title = HtmlNodes.stringify(current, true);
                if (!title.isEmpty()) {
                    codelab.setTitle(title);
                }
                continue;
            }
            if (HtmlNodes.isElement(current, "p") && codelab.getId().isEmpty()) {
                metadata.parse(current, codelab, options);
                continue;
            }
            if (HtmlNodes.isElement(current, "h2")) {
                openStep(context);
                continue;
            }
            if (context.step() != null) {
                parseTop(context);
            }
        }

        NodePostProcessor.finalizeStep(context.step());
        codelab.setDurationMinutes(StepDurations.wholeMinutes(context.totalDuration()));
        codelab.freeze();
        logger.info("Parsed codelab '{}' with {} steps ({} min)",
            codelab.getId(), codelab.getSteps().size(), codelab.getDurationMinutes());
        return codelab;
    }

    /**
     * Walks a fragment: content meant to be imported into a step of another codelab.
     *
     * @param document rendered markup tree
     * @return block-grouped and compacted fragment content
     * @throws CodelabParseException when the fragment declares steps or imports
     */
    public List<CodelabNode> walkFragment(Document document) {
        Element body = requireBody(document);
        Codelab codelab = new Codelab();
        WalkContext context = new WalkContext(codelab, ParseOptions.defaults());
        Step step = codelab.newStep(FRAGMENT_STEP_TITLE);
        context.step(step);

        for (context.moveTo(HtmlNodes.firstChild(body)); context.cursor() != null;
                context.moveTo(context.cursor().nextSibling())) {
            Node current = context.cursor();
            if (HtmlNodes.isElement(current, "h1") || HtmlNodes.isElement(current, "h2")) {
                throw new CodelabParseException(ParseFailure.FRAGMENT_STEPS_FORBIDDEN,
                    ((Element) current).normalName());
            }
            parseTop(context);
        }

        NodePostProcessor.finalizeStep(step);
        if (!NodeTraversal.imports(step.getContent()).isEmpty()) {
            throw new CodelabParseException(ParseFailure.FRAGMENT_IMPORTS_FORBIDDEN, (String) null);
        }
        step.freeze();
        return step.getContent();
    }

    @Override
    public List<CodelabNode> parseSubtree(WalkContext context) {
        List<CodelabNode> nodes = new ArrayList<>();
        for (context.moveTo(HtmlNodes.firstChild(context.cursor())); context.cursor() != null;
                context.moveTo(context.cursor().nextSibling())) {
            Dispatch dispatch = parseNode(context);
            if (dispatch.recognized()) {
                dispatch.node().ifPresent(nodes::add);
                continue;
            }
            try (CursorScope ignored = context.descend()) {
                nodes.addAll(parseSubtree(context));
            }
        }
        return nodes;
    }

    private void parseTop(WalkContext context) {
        Dispatch dispatch = parseNode(context);
        if (dispatch.recognized()) {
            dispatch.node().ifPresent(node -> context.append(List.of(node)));
            return;
        }
        List<CodelabNode> nodes;
        try (CursorScope ignored = context.descend()) {
            nodes = parseSubtree(context);
        }
        context.append(NodePostProcessor.compact(nodes));
    }

    /**
     * Classifies the node at the cursor and builds it. Checks run in priority order; the first
     * match wins.
     */
    private Dispatch parseNode(WalkContext context) {
        Node current = context.cursor();
        if (HtmlNodes.isText(current) && HtmlNodes.stringify(current, false).isBlank()) {
            return Dispatch.SKIPPED;
        }
        if (instructions.isInstruction(current)) {
            String prose = instructions.apply(context);
            return prose.isBlank() ? Dispatch.SKIPPED : Dispatch.of(inline.text(context, prose));
        }
        if (InlineNodeBuilder.isTextOrLineBreak(current)) {
            return Dispatch.of(inline.text(context));
        }
        if (InlineNodeBuilder.isLink(current)) {
            return Dispatch.of(inline.link(context));
        }
        if (EmbedNodeBuilder.isImage(current)) {
            return Dispatch.of(embeds.image(context));
        }
        if (InlineNodeBuilder.isButton(current)) {
            return Dispatch.of(inline.button(context));
        }
        if (BlockNodeBuilder.isHeader(current)) {
            return Dispatch.of(blocks.header(context));
        }
        if (BlockNodeBuilder.isList(current)) {
            return Dispatch.of(blocks.list(context));
        }
        if (blocks.isConsole(current)) {
            return Dispatch.of(blocks.code(context, true));
        }
        if (BlockNodeBuilder.isCode(current)) {
            return Dispatch.of(blocks.code(context, false));
        }
        if (ContainerNodeBuilder.isInfobox(current)) {
            return Dispatch.of(containers.infobox(context));
        }
        if (ContainerNodeBuilder.isSurvey(current)) {
            return Dispatch.of(containers.survey(context));
        }
        if (ContainerNodeBuilder.isTable(current)) {
            return Dispatch.of(containers.table(context));
        }
        if (EmbedNodeBuilder.isVideo(current)) {
            return Dispatch.of(embeds.youtube(context));
        }
        if (embeds.isImport(current)) {
            return Dispatch.of(embeds.importReference(context));
        }
        return Dispatch.UNRECOGNIZED;
    }

    private void openStep(WalkContext context) {
        String title = HtmlNodes.stringify(context.cursor(), true);
        if (title.isEmpty()) {
            return;
        }
        NodePostProcessor.finalizeStep(context.step());
        context.step(context.codelab().newStep(title));
        context.clearEnvironments();
        logger.debug("Opened step '{}'", title);
    }

    private static Element requireBody(Document document) {
        Element body = document == null ? null : document.selectFirst("body");
        if (body == null) {
            throw new CodelabParseException(ParseFailure.MISSING_BODY, (String) null);
        }
        return body;
    }

    /**
     * Outcome of classifying one tree node: not recognized (walk its children instead), or
     * recognized with an optional built node.
     */
    private record Dispatch(boolean recognized, Optional<CodelabNode> node) {

        static final Dispatch UNRECOGNIZED = new Dispatch(false, Optional.empty());
        static final Dispatch SKIPPED = new Dispatch(true, Optional.empty());

        static Dispatch of(Optional<CodelabNode> built) {
            return new Dispatch(true, built);
        }
    }
}

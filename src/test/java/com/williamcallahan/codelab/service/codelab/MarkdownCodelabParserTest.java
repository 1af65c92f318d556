package com.williamcallahan.codelab.service.codelab;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.codelab.config.AppProperties;
import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.domain.codelab.Step;
import com.williamcallahan.codelab.domain.codelab.node.BlockNode;
import com.williamcallahan.codelab.domain.codelab.node.ButtonNode;
import com.williamcallahan.codelab.domain.codelab.node.CodeNode;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.GridCell;
import com.williamcallahan.codelab.domain.codelab.node.GridNode;
import com.williamcallahan.codelab.domain.codelab.node.HeaderNode;
import com.williamcallahan.codelab.domain.codelab.node.IframeNode;
import com.williamcallahan.codelab.domain.codelab.node.ImageNode;
import com.williamcallahan.codelab.domain.codelab.node.ImportNode;
import com.williamcallahan.codelab.domain.codelab.node.InfoboxKind;
import com.williamcallahan.codelab.domain.codelab.node.InfoboxNode;
import com.williamcallahan.codelab.domain.codelab.node.ItemsListNode;
import com.williamcallahan.codelab.domain.codelab.node.LinkNode;
import com.williamcallahan.codelab.domain.codelab.node.NodeKind;
import com.williamcallahan.codelab.domain.codelab.node.NodeTraversal;
import com.williamcallahan.codelab.domain.codelab.node.SurveyNode;
import com.williamcallahan.codelab.domain.codelab.node.TextNode;
import com.williamcallahan.codelab.domain.codelab.node.YouTubeNode;
import com.williamcallahan.codelab.service.markdown.FlexmarkMarkupRenderer;
import com.williamcallahan.codelab.service.markdown.ImportDirectivePreprocessor;
import com.williamcallahan.codelab.service.markdown.JsoupMarkupTreeBuilder;
import com.williamcallahan.codelab.service.markdown.MarkupRenderer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Parses markdown codelabs end to end through flexmark and jsoup.
 */
class MarkdownCodelabParserTest {

    private static final String HEADER = """
        # My Codelab

        id: my-codelab
        authors: Jane Doe

        """;

    private MarkdownCodelabParser parser;

    @BeforeEach
    void setUp() {
        parser = newParser(new FlexmarkMarkupRenderer());
    }

    @Test
    @DisplayName("Should parse title, metadata, steps, durations and environments")
    void testEndToEndDocument() {
        Codelab codelab = parser.parse(HEADER + """
            ## Step One

            Duration: 2:30

            Environment: web, ios

            Hello **world**
            """, ParseOptions.defaults());

        assertEquals("My Codelab", codelab.getTitle());
        assertEquals("my-codelab", codelab.getId());
        assertEquals("Jane Doe", codelab.getAuthors());
        assertEquals(1, codelab.getSteps().size());

        Step step = codelab.getSteps().get(0);
        assertEquals("Step One", step.getTitle());
        assertEquals("step-one", step.getSlug());
        assertEquals(3, step.getDurationMinutes());
        assertEquals(3, codelab.getDurationMinutes());
        assertEquals(List.of("ios", "web"), List.copyOf(step.getTags()));
        assertEquals(List.of("ios", "web"), List.copyOf(codelab.getTags()));

        assertEquals(1, step.getContent().size());
        BlockNode block = assertInstanceOf(BlockNode.class, step.getContent().get(0));
        assertEquals(2, block.getContent().size());
        TextNode hello = assertInstanceOf(TextNode.class, block.getContent().get(0));
        TextNode world = assertInstanceOf(TextNode.class, block.getContent().get(1));
        assertEquals("Hello ", hello.getValue());
        assertFalse(hello.isBold());
        assertEquals("world", world.getValue());
        assertTrue(world.isBold());
        assertEquals(List.of("ios", "web"), List.copyOf(hello.getEnvironments()));
        assertEquals(List.of("ios", "web"), List.copyOf(world.getEnvironments()));
    }

    @Test
    @DisplayName("Should keep prose that follows instructions in the same paragraph")
    void testInstructionsAndProseInOneParagraph() {
        Codelab codelab = parser.parse(HEADER + """
            ## Step One

            Duration: 2:30
            Environment: web, ios
            Hello **world**
            """, ParseOptions.defaults());

        Step step = codelab.getSteps().get(0);
        assertEquals(3, step.getDurationMinutes());
        assertEquals(List.of("ios", "web"), List.copyOf(step.getTags()));

        assertEquals(1, step.getContent().size());
        BlockNode block = assertInstanceOf(BlockNode.class, step.getContent().get(0));
        assertEquals(2, block.getContent().size());
        TextNode hello = assertInstanceOf(TextNode.class, block.getContent().get(0));
        TextNode world = assertInstanceOf(TextNode.class, block.getContent().get(1));
        assertEquals("Hello ", hello.getValue());
        assertFalse(hello.isBold());
        assertEquals("world", world.getValue());
        assertTrue(world.isBold());
        assertEquals(List.of("ios", "web"), List.copyOf(hello.getEnvironments()));
    }

    @Test
    @DisplayName("Should clamp oversized durations instead of failing")
    void testOversizedDurations() {
        Codelab codelab = parser.parse(HEADER + """
            ## Huge

            Duration: 3000000000

            ## Overflowing

            Duration: 9999999999999999:00:00

            ## Large

            Duration: 2000000000

            ## Larger

            Duration: 2000000000
            """, ParseOptions.defaults());

        assertEquals(List.of(Integer.MAX_VALUE, 0, 2_000_000_000, 2_000_000_000),
            codelab.getSteps().stream().map(Step::getDurationMinutes).toList());
        assertEquals(Integer.MAX_VALUE, codelab.getDurationMinutes());
    }

    @Test
    @DisplayName("Should sum rounded step durations into the codelab duration")
    void testDurationsAcrossSteps() {
        Codelab codelab = parser.parse(HEADER + """
            ## One

            Duration: 0:44

            ## Two

            Duration: 5

            ## Three

            Text only.
            """, ParseOptions.defaults());

        assertEquals(List.of(1, 5, 0), codelab.getSteps().stream().map(Step::getDurationMinutes).toList());
        assertEquals(6, codelab.getDurationMinutes());
    }

    @Test
    @DisplayName("Should ignore content before the first step and skip empty step titles")
    void testContentBeforeFirstStep() {
        Codelab codelab = parser.parse(HEADER + """
            Stray paragraph.

            ##

            ## Real Step

            Body.
            """, ParseOptions.defaults());

        assertEquals(1, codelab.getSteps().size());
        assertEquals("Real Step", codelab.getSteps().get(0).getTitle());
        assertEquals("Body.", joinedText(codelab.getSteps().get(0).getContent()));
    }

    @Test
    @DisplayName("Should fail when the metadata paragraph has no id")
    void testMissingId() {
        CodelabParseException failure = assertThrows(CodelabParseException.class,
            () -> parser.parse("# Title\n\nauthors: Jane\n\n## Step\n", ParseOptions.defaults()));

        assertEquals(ParseFailure.MISSING_METADATA_ID, failure.failure());
    }

    @Test
    @DisplayName("Should pass through allow-listed metadata")
    void testPassMetadata() {
        String source = "# T\n\nid: t\nproduct: Maps\n\n## S\n\nx\n";

        Codelab passed = parser.parse(source, ParseOptions.passing(List.of("Product")));
        Codelab dropped = parser.parse(source, ParseOptions.defaults());

        assertEquals(Map.of("product", "Maps"), passed.getExtra());
        assertTrue(dropped.getExtra().isEmpty());
    }

    @Test
    @DisplayName("Should freeze the returned codelab")
    void testFrozenResult() {
        Codelab codelab = parser.parse(HEADER + "## S\n\nx\n", ParseOptions.defaults());

        assertThrows(IllegalStateException.class, () -> codelab.newStep("late"));
        assertThrows(IllegalStateException.class, () -> codelab.getSteps().get(0).setDurationMinutes(4));

        BlockNode block = assertInstanceOf(BlockNode.class, codelab.getSteps().get(0).getContent().get(0));
        TextNode text = assertInstanceOf(TextNode.class, block.getContent().get(0));
        assertTrue(block.isFrozen());
        assertThrows(IllegalStateException.class, () -> block.replaceContent(List.of()));
        assertThrows(IllegalStateException.class, () -> block.addEnvironments(List.of("Injected")));
        assertThrows(IllegalStateException.class, () -> text.setBold(true));
        assertEquals(List.of(text), block.getContent());
        assertTrue(block.getEnvironments().isEmpty());
    }

    @Test
    @DisplayName("Should turn learning headings and their lists into checklists")
    void testChecklist() {
        Codelab codelab = parser.parse(HEADER + """
            ## Overview

            ### What you'll learn

            * How to parse
            * How to test

            ### Frequently Asked Questions

            1. Why?
            2. Because.
            """, ParseOptions.defaults());

        List<CodelabNode> content = codelab.getSteps().get(0).getContent();
        assertEquals(4, content.size());
        HeaderNode learn = assertInstanceOf(HeaderNode.class, content.get(0));
        assertEquals(NodeKind.HEADER_CHECKLIST, learn.getKind());
        assertEquals(3, learn.getLevel());
        ItemsListNode checklist = assertInstanceOf(ItemsListNode.class, content.get(1));
        assertEquals(NodeKind.ITEMS_CHECKLIST, checklist.getKind());
        assertEquals(2, checklist.getItems().size());
        assertFalse(checklist.isOrdered());

        assertEquals(NodeKind.HEADER_FAQ, content.get(2).getKind());
        ItemsListNode faq = assertInstanceOf(ItemsListNode.class, content.get(3));
        assertEquals(NodeKind.ITEMS_FAQ, faq.getKind());
        assertTrue(faq.isOrdered());
        assertEquals("1", faq.getListType());
    }

    @Test
    @DisplayName("Should build infoboxes from positive and negative definitions")
    void testInfobox() {
        Codelab codelab = parser.parse(HEADER + """
            ## Tips

            Negative
            : Do not do this.
            """, ParseOptions.defaults());

        List<CodelabNode> infoboxes = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node.getKind() == NodeKind.INFOBOX);
        assertEquals(1, infoboxes.size());
        InfoboxNode infobox = (InfoboxNode) infoboxes.get(0);
        assertEquals(InfoboxKind.NEGATIVE, infobox.getInfoboxKind());
        assertEquals("Do not do this.", joinedText(infobox.getContent()).trim());
    }

    @Test
    @DisplayName("Should build grids with cell spans from raw HTML tables")
    void testTableWithSpans() {
        Codelab codelab = parser.parse(HEADER + """
            ## Table

            <table>
            <tr><td colspan="2">Wide</td></tr>
            <tr><td>A</td><td rowspan="3">B</td></tr>
            </table>
            """, ParseOptions.defaults());

        List<CodelabNode> grids = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node.getKind() == NodeKind.GRID);
        assertEquals(1, grids.size());
        List<List<GridCell>> rows = ((GridNode) grids.get(0)).getRows();
        assertEquals(2, rows.size());
        assertEquals(1, rows.get(0).size());
        assertEquals(2, rows.get(0).get(0).colspan());
        assertEquals(1, rows.get(0).get(0).rowspan());
        assertEquals("Wide", joinedText(rows.get(0).get(0).content()));
        assertEquals(2, rows.get(1).size());
        assertEquals(3, rows.get(1).get(1).rowspan());
    }

    @Test
    @DisplayName("Should tag fenced code with language and console output as terminal")
    void testCodeBlocks() {
        Codelab codelab = parser.parse(HEADER + """
            ## Code

            ```java
            int x = 1;
            ```

            ```console
            $ make
            ```
            """, ParseOptions.defaults());

        List<CodelabNode> code = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node.getKind() == NodeKind.CODE);
        assertEquals(2, code.size());
        CodeNode java = (CodeNode) code.get(0);
        assertEquals("java", java.getLanguage());
        assertFalse(java.isTerminal());
        assertEquals("\nint x = 1;\n", java.getValue());
        CodeNode console = (CodeNode) code.get(1);
        assertTrue(console.isTerminal());
        assertEquals("", console.getLanguage());
    }

    @Test
    @DisplayName("Should keep inline code as styled text")
    void testInlineCode() {
        Codelab codelab = parser.parse(HEADER + "## S\n\nRun `make` now.\n", ParseOptions.defaults());

        List<CodelabNode> texts = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node instanceof TextNode text && text.isCode());
        assertEquals(1, texts.size());
        assertEquals("make", ((TextNode) texts.get(0)).getValue());
    }

    @Test
    @DisplayName("Should build links, buttons and download buttons")
    void testLinksAndButtons() {
        Codelab codelab = parser.parse(HEADER + """
            ## Links

            See [the docs](https://example.com/docs).

            <button><a href="https://example.com/sdk.zip">Download SDK</a></button>
            """, ParseOptions.defaults());

        List<CodelabNode> links = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node.getKind() == NodeKind.LINK);
        assertEquals(2, links.size());
        LinkNode docs = (LinkNode) links.get(0);
        assertEquals("https://example.com/docs", docs.getUrl());
        assertEquals("the docs", joinedText(docs.getContent()));

        LinkNode download = (LinkNode) links.get(1);
        assertEquals("https://example.com/sdk.zip", download.getUrl());
        ButtonNode button = assertInstanceOf(ButtonNode.class, download.getContent().get(0));
        assertTrue(button.isDownload());
        assertTrue(button.isRaised());
        assertTrue(button.isColored());
    }

    @Test
    @DisplayName("Should embed videos and allow-listed frames from image alt text")
    void testEmbeds() {
        Codelab codelab = parser.parse(HEADER + """
            ## Media

            ![https://www.youtube.com/watch?v=abc123](thumb.png)

            ![https://codepen.io/team/pen/xyz](preview.png)

            ![https://evil.example.com/frame](photo.png)

            <video id="dQw4w9WgXcQ"></video>
            """, ParseOptions.defaults());

        List<CodelabNode> content = codelab.getSteps().get(0).getContent();
        List<CodelabNode> videos = NodeTraversal.collect(content, node -> node.getKind() == NodeKind.YOUTUBE);
        assertEquals(List.of("abc123", "dQw4w9WgXcQ"),
            videos.stream().map(node -> ((YouTubeNode) node).getVideoId()).toList());

        List<CodelabNode> frames = NodeTraversal.collect(content, node -> node.getKind() == NodeKind.IFRAME);
        assertEquals(1, frames.size());
        assertEquals("https://codepen.io/team/pen/xyz", ((IframeNode) frames.get(0)).getUrl());

        List<CodelabNode> images = NodeTraversal.collect(content, node -> node.getKind() == NodeKind.IMAGE);
        assertEquals(1, images.size());
        assertEquals("photo.png", ((ImageNode) images.get(0)).getSrc());
    }

    @Test
    @DisplayName("Should keep an image whose alt text mentions a URL")
    void testImageAltMentioningUrl() {
        Codelab codelab = parser.parse(HEADER + """
            ## Media

            ![Screenshot of https://example.com/page](shot.png)
            """, ParseOptions.defaults());

        List<CodelabNode> images = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node.getKind() == NodeKind.IMAGE);
        assertEquals(1, images.size());
        ImageNode image = (ImageNode) images.get(0);
        assertEquals("shot.png", image.getSrc());
        assertEquals("Screenshot of https://example.com/page", image.getAlt());
    }

    @Test
    @DisplayName("Should number surveys per document")
    void testSurveys() {
        Codelab codelab = parser.parse(HEADER + """
            ## Survey

            <form>
            <name>Which OS?</name>
            <input type="radio" value="Linux">
            <input type="radio" value="macOS">
            </form>

            <form>
            <name>Rate it</name>
            <input type="radio" value="Good">
            </form>
            """, ParseOptions.defaults());

        List<CodelabNode> surveys = NodeTraversal.collect(codelab.getSteps().get(0).getContent(),
            node -> node.getKind() == NodeKind.SURVEY);
        assertEquals(2, surveys.size());
        SurveyNode first = (SurveyNode) surveys.get(0);
        assertEquals("my-codelab-1", first.getId());
        assertEquals("Which OS?", first.getGroups().get(0).name());
        assertEquals(List.of("Linux", "macOS"), first.getGroups().get(0).options());
        assertEquals("my-codelab-2", ((SurveyNode) surveys.get(1)).getId());
    }

    @Test
    @DisplayName("Should keep import references in full documents")
    void testImportInDocument() {
        Codelab codelab = parser.parse(HEADER + "## Setup\n\n<<shared/setup.md>>\n", ParseOptions.defaults());

        List<ImportNode> imports = NodeTraversal.imports(codelab.getSteps().get(0).getContent());
        assertEquals(1, imports.size());
        assertEquals("shared/setup.md", imports.get(0).getUrl());
    }

    @Test
    @DisplayName("Should accept extra titles and imports in full documents")
    void testFragmentOnlyRestrictionsDoNotApplyToDocuments() {
        Codelab codelab = parser.parse(HEADER + """
            ## Setup

            # Another title

            <<shared/setup.md>>

            ## Next

            Done.
            """, ParseOptions.defaults());

        assertEquals(2, codelab.getSteps().size());
        List<CodelabNode> setup = codelab.getSteps().get(0).getContent();
        HeaderNode header = assertInstanceOf(HeaderNode.class, setup.get(0));
        assertEquals(1, header.getLevel());
        assertEquals("Another title", joinedText(header.getContent()));
        assertEquals(1, NodeTraversal.imports(setup).size());
        assertEquals("My Codelab", codelab.getTitle());
    }

    @Test
    @DisplayName("Should parse fragments into compacted content")
    void testFragment() {
        List<CodelabNode> content = parser.parseFragment("Some *shared* text.\n\n* one\n* two\n");

        assertEquals(2, content.size());
        assertInstanceOf(BlockNode.class, content.get(0));
        assertEquals("Some shared text.", joinedText(content.get(0)));
        assertEquals(NodeKind.ITEMS_LIST, content.get(1).getKind());
    }

    @Test
    @DisplayName("Should reject steps and imports in fragments")
    void testFragmentRestrictions() {
        CodelabParseException steps = assertThrows(CodelabParseException.class,
            () -> parser.parseFragment("## Not allowed\n\ntext\n"));
        CodelabParseException title = assertThrows(CodelabParseException.class,
            () -> parser.parseFragment("# Not allowed either\n"));
        CodelabParseException imports = assertThrows(CodelabParseException.class,
            () -> parser.parseFragment("<<other.md>>\n"));

        assertEquals(ParseFailure.FRAGMENT_STEPS_FORBIDDEN, steps.failure());
        assertEquals(ParseFailure.FRAGMENT_STEPS_FORBIDDEN, title.failure());
        assertEquals(ParseFailure.FRAGMENT_IMPORTS_FORBIDDEN, imports.failure());
    }

    @Test
    @DisplayName("Should wrap renderer failures as render failures")
    void testRendererFailure() {
        MarkupRenderer failing = mock(MarkupRenderer.class);
        IllegalStateException boom = new IllegalStateException("boom");
        when(failing.render(anyString())).thenThrow(boom);
        MarkdownCodelabParser broken = newParser(failing);

        CodelabParseException failure = assertThrows(CodelabParseException.class,
            () -> broken.parse("# T", ParseOptions.defaults()));

        assertEquals(ParseFailure.RENDER_FAILED, failure.failure());
        assertSame(boom, failure.getCause());
    }

    @Test
    @DisplayName("Should fall back to configured pass-through keys")
    void testConfiguredPassMetadata() {
        AppProperties properties = new AppProperties();
        properties.getParser().setPassMetadata(List.of("product"));
        MarkdownCodelabParser configured = new MarkdownCodelabParser(new ImportDirectivePreprocessor(),
            new FlexmarkMarkupRenderer(), new JsoupMarkupTreeBuilder(), properties);

        Codelab codelab = configured.parse("# T\n\nid: t\nproduct: Maps\n\n## S\n\nx\n", ParseOptions.defaults());

        assertEquals(Map.of("product", "Maps"), codelab.getExtra());
    }

    private static MarkdownCodelabParser newParser(MarkupRenderer renderer) {
        return new MarkdownCodelabParser(new ImportDirectivePreprocessor(), renderer,
            new JsoupMarkupTreeBuilder(), new AppProperties());
    }

    private static String joinedText(CodelabNode node) {
        return joinedText(List.of(node));
    }

    private static String joinedText(List<CodelabNode> nodes) {
        StringBuilder text = new StringBuilder();
        for (CodelabNode node : NodeTraversal.collect(nodes, candidate -> candidate instanceof TextNode)) {
            text.append(((TextNode) node).getValue());
        }
        return text.toString();
    }
}

package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.GridCell;
import com.williamcallahan.codelab.domain.codelab.node.GridNode;
import com.williamcallahan.codelab.domain.codelab.node.InfoboxKind;
import com.williamcallahan.codelab.domain.codelab.node.InfoboxNode;
import com.williamcallahan.codelab.domain.codelab.node.SurveyGroup;
import com.williamcallahan.codelab.domain.codelab.node.SurveyNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the nodes that own nested content regions: infoboxes, tables and surveys.
 * Each region is block-grouped and compacted on its own.
 */
final class ContainerNodeBuilder {

    private static final Set<String> CELL_TAGS = Set.of("td", "th");

    private final SubtreeWalker walker;

    ContainerNodeBuilder(SubtreeWalker walker) {
        this.walker = walker;
    }

    /**
     * Reports whether a node is an infobox marker: a definition term reading {@code positive} or
     * {@code negative} followed by its definition.
     */
    static boolean isInfobox(Node node) {
        if (!HtmlNodes.isElement(node, "dt")) {
            return false;
        }
        Element term = (Element) node;
        if (InfoboxKind.fromMarker(HtmlNodes.stringify(term, true)).isEmpty()) {
            return false;
        }
        Element definition = term.nextElementSibling();
        return definition != null && definition.normalName().equals("dd");
    }

    static boolean isTable(Node node) {
        return HtmlNodes.isElement(node, "table");
    }

    static boolean isSurvey(Node node) {
        return HtmlNodes.isElement(node, "form") && ((Element) node).selectFirst("name") != null;
    }

    /**
     * Builds an infobox from the marker at the cursor and the definition after it. The cursor is
     * left on the definition so the walk resumes past it.
     *
     * @param context walk state
     * @return infobox, empty when the definition has no content
     */
    Optional<CodelabNode> infobox(WalkContext context) {
        Element term = (Element) context.cursor();
        InfoboxKind kind = InfoboxKind.fromMarker(HtmlNodes.stringify(term, true)).orElseThrow();
        Element definition = term.nextElementSibling();
        context.moveTo(definition);

        List<CodelabNode> content;
        try (CursorScope ignored = context.descend()) {
            content = NodePostProcessor.process(walker.parseSubtree(context));
        }
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new InfoboxNode(kind, content));
    }

    /**
     * Builds a grid from a table. Rows of nested tables belong to those tables; cells without
     * content are skipped.
     *
     * @param context walk state
     * @return grid, empty when the table has no rows
     */
    Optional<CodelabNode> table(WalkContext context) {
        Element table = (Element) context.cursor();
        List<List<GridCell>> rows = new ArrayList<>();
        for (Element row : table.select("tr")) {
            if (row.closest("table") != table) {
                continue;
            }
            rows.add(tableRow(context, row));
        }
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GridNode(rows));
    }

    private List<GridCell> tableRow(WalkContext context, Element row) {
        List<GridCell> cells = new ArrayList<>();
        for (Element cell : row.children()) {
            if (!CELL_TAGS.contains(cell.normalName())) {
                continue;
            }
            List<CodelabNode> content;
            try (CursorScope ignored = context.descend(cell)) {
                content = NodePostProcessor.process(walker.parseSubtree(context));
            }
            if (content.isEmpty()) {
                continue;
            }
            cells.add(new GridCell(span(cell.attr("colspan")), span(cell.attr("rowspan")), content));
        }
        return cells;
    }

    /**
     * Builds a survey. Each {@code <name>} opens a question and the {@code <input>} values after it
     * are its options; questions without options are dropped.
     *
     * @param context walk state
     * @return survey with a document-unique id, empty when no question has options
     */
    Optional<CodelabNode> survey(WalkContext context) {
        Element form = (Element) context.cursor();
        List<SurveyGroup> groups = new ArrayList<>();
        String question = null;
        List<String> options = new ArrayList<>();
        for (Element element : form.select("name, input")) {
            if (element.normalName().equals("name")) {
                addGroup(groups, question, options);
                question = element.text().trim();
                options = new ArrayList<>();
            } else if (question != null && element.hasAttr("value")) {
                options.add(element.attr("value"));
            }
        }
        addGroup(groups, question, options);
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SurveyNode(context.nextSurveyId(), groups));
    }

    private static void addGroup(List<SurveyGroup> groups, String question, List<String> options) {
        if (question != null && !options.isEmpty()) {
            groups.add(new SurveyGroup(question, options));
        }
    }

    private static int span(String value) {
        try {
            return Math.max(1, Integer.parseInt(value.trim()));
        } catch (NumberFormatException notDeclared) {
            return 1;
        }
    }
}

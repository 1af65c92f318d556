package com.williamcallahan.codelab.service.markdown;

import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code <<path/to/file.md>>} import directives into HTML comment placeholders before
 * rendering, so the markdown renderer passes them through untouched, and recognizes those
 * placeholders in the rendered tree.
 */
@Component
public class ImportDirectivePreprocessor {

    static final String PLACEHOLDER_PREFIX = "__unsupported_import_zmcgv2epyv=";

    private static final Pattern IMPORT_DIRECTIVE = Pattern.compile("^<<([^<>()]+\\.md)>>\\s*$");

    /**
     * Replaces every line that is exactly an import directive with its placeholder comment.
     *
     * @param markdown raw markdown
     * @return markdown with directives converted
     */
    public String convertImports(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        String[] lines = markdown.split("\n", -1);
        StringBuilder converted = new StringBuilder(markdown.length() + 32);
        for (int index = 0; index < lines.length; index++) {
            if (index > 0) {
                converted.append('\n');
            }
            Matcher matcher = IMPORT_DIRECTIVE.matcher(lines[index]);
            if (matcher.matches()) {
                converted.append("<!--")
                    .append(PLACEHOLDER_PREFIX)
                    .append(Entities.escape(matcher.group(1)))
                    .append("-->");
            } else {
                converted.append(lines[index]);
            }
        }
        return converted.toString();
    }

    /**
     * Reports whether a tree node is an import placeholder.
     *
     * @param node tree node
     * @return true for placeholder comments
     */
    public boolean isPlaceholder(Node node) {
        return node instanceof Comment comment && comment.getData().startsWith(PLACEHOLDER_PREFIX);
    }

    /**
     * Extracts the referenced path from a placeholder comment.
     *
     * @param node tree node
     * @return referenced path, empty when the node is not a placeholder or names nothing
     */
    public Optional<String> importTarget(Node node) {
        if (!isPlaceholder(node)) {
            return Optional.empty();
        }
        String data = ((Comment) node).getData().substring(PLACEHOLDER_PREFIX.length());
        String target = Parser.unescapeEntities(data, false).trim();
        return target.isEmpty() ? Optional.empty() : Optional.of(target);
    }
}

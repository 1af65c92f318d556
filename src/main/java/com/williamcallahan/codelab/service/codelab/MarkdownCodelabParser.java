package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.config.AppProperties;
import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.service.markdown.ImportDirectivePreprocessor;
import com.williamcallahan.codelab.service.markdown.MarkupRenderer;
import com.williamcallahan.codelab.service.markdown.MarkupTreeBuilder;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Parses codelabs authored in markdown: import directives are rewritten to placeholders, the
 * markdown is rendered to markup, and the markup tree is walked into the document model.
 */
@Service
public class MarkdownCodelabParser implements CodelabParser {

    static final String FORMAT = "md";

    private final ImportDirectivePreprocessor importDirectives;
    private final MarkupRenderer renderer;
    private final MarkupTreeBuilder treeBuilder;
    private final DocumentWalker walker;
    private final ParseOptions configuredOptions;

    /**
     * Creates the markdown parser with its rendering collaborators and configured settings.
     */
    public MarkdownCodelabParser(ImportDirectivePreprocessor importDirectives,
                                 MarkupRenderer renderer,
                                 MarkupTreeBuilder treeBuilder,
                                 AppProperties appProperties) {
        this.importDirectives = Objects.requireNonNull(importDirectives, "Import directive preprocessor cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "Markup renderer cannot be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "Markup tree builder cannot be null");
        var parsing = appProperties.getParser();
        this.walker = new DocumentWalker(parsing.getIframeAllowlist(), parsing.getConsoleLanguages(), importDirectives);
        this.configuredOptions = ParseOptions.passing(parsing.getPassMetadata());
    }

    @Override
    public String format() {
        return FORMAT;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Options without pass-through keys fall back to the configured {@code app.parser.pass-metadata}.</p>
     */
    @Override
    public Codelab parse(String source, ParseOptions options) {
        ParseOptions effective = options == null || options.passMetadata().isEmpty() ? configuredOptions : options;
        return walker.walkDocument(toTree(source), effective);
    }

    @Override
    public List<CodelabNode> parseFragment(String source) {
        return walker.walkFragment(toTree(source));
    }

    private Document toTree(String source) {
        Objects.requireNonNull(source, "Codelab source cannot be null");
        try {
            String markup = renderer.render(importDirectives.convertImports(source));
            return treeBuilder.buildTree(markup);
        } catch (CodelabParseException parseFailure) {
            throw parseFailure;
        } catch (RuntimeException renderFailure) {
            throw new CodelabParseException(ParseFailure.RENDER_FAILED, renderFailure);
        }
    }
}

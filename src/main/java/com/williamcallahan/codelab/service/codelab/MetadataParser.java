package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the metadata paragraph that follows the codelab title: one {@code key: value} pair
 * per line, keys case-insensitive.
 */
final class MetadataParser {

    private static final Logger logger = LoggerFactory.getLogger(MetadataParser.class);

    static final String AUTHORS = "authors";
    static final String BADGE_PATH = "badge path";
    static final String SUMMARY = "summary";
    static final String ID = "id";
    static final String CATEGORIES = "categories";
    static final String ENVIRONMENTS = "environments";
    static final String STATUS = "status";
    static final String FEEDBACK_LINK = "feedback link";
    static final String ANALYTICS_ACCOUNT = "analytics account";
    static final String TAGS = "tags";

    private static final Pattern METADATA_LINE = Pattern.compile("(.+?):(.+)");

    /**
     * Reads the metadata paragraph into {@code codelab}.
     *
     * @param paragraph metadata paragraph
     * @param codelab document under construction
     * @param options pass-through allow-list
     * @throws CodelabParseException when no non-empty id is declared
     */
    void parse(Node paragraph, Codelab codelab, ParseOptions options) {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (String line : HtmlNodes.lines(paragraph).split("\n")) {
            Matcher matcher = METADATA_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String key = AsciiTextNormalizer.toLowerAscii(matcher.group(1)).trim();
            metadata.put(key, matcher.group(2).trim());
        }
        String id = metadata.get(ID);
        if (id == null || id.isEmpty()) {
            throw new CodelabParseException(ParseFailure.MISSING_METADATA_ID, metadata.keySet().toString());
        }
        metadata.forEach((key, value) -> apply(codelab, options, key, value));
    }

    private void apply(Codelab codelab, ParseOptions options, String key, String value) {
        switch (key) {
            case AUTHORS -> codelab.setAuthors(value);
            case BADGE_PATH -> codelab.setBadgePath(value);
            case SUMMARY -> codelab.setSummary(value);
            case ID -> codelab.setId(value);
            case CATEGORIES -> codelab.addCategories(AsciiTextNormalizer.splitList(value));
            case ENVIRONMENTS, TAGS -> codelab.addTags(AsciiTextNormalizer.splitList(value));
            case STATUS -> codelab.setStatus(AsciiTextNormalizer.splitList(value));
            case FEEDBACK_LINK -> codelab.setFeedbackLink(value);
            case ANALYTICS_ACCOUNT -> codelab.setAnalyticsAccount(value);
            default -> {
                if (options.passes(key)) {
                    codelab.putExtra(key, value);
                } else {
                    logger.debug("Dropping metadata key '{}' not in pass-through list", key);
                }
            }
        }
    }
}

package com.williamcallahan.codelab.service.codelab;

import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.codelab.node.IframeNode;
import com.williamcallahan.codelab.domain.codelab.node.ImageNode;
import com.williamcallahan.codelab.domain.codelab.node.ImportNode;
import com.williamcallahan.codelab.domain.codelab.node.YouTubeNode;
import com.williamcallahan.codelab.service.markdown.ImportDirectivePreprocessor;
import com.williamcallahan.codelab.support.AsciiTextNormalizer;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;

/**
 * Builds images, video and frame embeds, and import references.
 */
final class EmbedNodeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(EmbedNodeBuilder.class);

    private static final String YOUTUBE_WATCH = "youtube.com/watch";
    private static final String HTTPS_PREFIX = "https://";
    private static final String HTTPS = "https";

    private final List<String> iframeAllowlist;
    private final ImportDirectivePreprocessor importDirectives;

    EmbedNodeBuilder(List<String> iframeAllowlist, ImportDirectivePreprocessor importDirectives) {
        this.iframeAllowlist = iframeAllowlist.stream()
            .map(domain -> AsciiTextNormalizer.toLowerAscii(domain).trim())
            .toList();
        this.importDirectives = importDirectives;
    }

    static boolean isImage(Node node) {
        return HtmlNodes.isElement(node, "img");
    }

    static boolean isVideo(Node node) {
        return HtmlNodes.isElement(node, "video");
    }

    boolean isImport(Node node) {
        return importDirectives.isPlaceholder(node);
    }

    /**
     * Builds an image, or an embed when the alt text points at a video or an allow-listed frame.
     *
     * @param context walk state
     * @return image or embed, empty for a missing source or an invalid width
     */
    Optional<CodelabNode> image(WalkContext context) {
        Node current = context.cursor();
        String alt = HtmlNodes.attr(current, "alt");
        if (alt.contains(YOUTUBE_WATCH)) {
            return youtube(context);
        }
        if (alt.contains(HTTPS_PREFIX) && parseUri(alt.trim()).filter(this::isAllowlisted).isPresent()) {
            return iframe(context);
        }

        String src = HtmlNodes.attr(current, "src");
        if (src.isEmpty()) {
            logger.debug("Dropping image without src");
            return Optional.empty();
        }
        ImageNode image = new ImageNode(src);
        image.setAlt(alt);
        image.setTitle(HtmlNodes.attr(current, "title"));
        String width = HtmlNodes.attr(current, "width");
        if (!width.isEmpty()) {
            try {
                image.setWidth(Float.parseFloat(width.trim()));
            } catch (NumberFormatException invalidWidth) {
                logger.debug("Dropping image {} with non-numeric width '{}'", src, width);
                return Optional.empty();
            }
        }
        image.setBlock(HtmlNodes.findBlockParent(current));
        return Optional.of(image);
    }

    /**
     * Builds a YouTube embed from the element id or from the {@code v} parameter of the watch
     * URL in the alt text.
     *
     * @param context walk state
     * @return video embed, empty when no video id can be found
     */
    Optional<CodelabNode> youtube(WalkContext context) {
        Node current = context.cursor();
        String videoId = HtmlNodes.attr(current, "id").trim();
        if (videoId.isEmpty()) {
            videoId = parseUri(HtmlNodes.attr(current, "alt").trim())
                .map(EmbedNodeBuilder::watchParameter)
                .orElse("");
        }
        if (videoId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new YouTubeNode(videoId));
    }

    /**
     * Builds a frame embed from the alt URL. Only https targets are accepted.
     *
     * @param context walk state
     * @return frame embed, empty for non-https targets
     */
    Optional<CodelabNode> iframe(WalkContext context) {
        Optional<URI> uri = parseUri(HtmlNodes.attr(context.cursor(), "alt").trim());
        if (uri.isEmpty() || !HTTPS.equals(uri.get().getScheme())) {
            logger.debug("Dropping frame embed with non-https target");
            return Optional.empty();
        }
        return Optional.of(new IframeNode(uri.get().toString()));
    }

    /**
     * Builds an import reference from a preprocessor placeholder.
     *
     * @param context walk state
     * @return import node, empty when the placeholder names no target
     */
    Optional<CodelabNode> importReference(WalkContext context) {
        return importDirectives.importTarget(context.cursor()).map(ImportNode::new);
    }

    private boolean isAllowlisted(URI uri) {
        String host = AsciiTextNormalizer.toLowerAscii(uri.getHost());
        if (host.isEmpty()) {
            return false;
        }
        for (String domain : iframeAllowlist) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<URI> parseUri(String value) {
        try {
            return Optional.of(new URI(value));
        } catch (URISyntaxException invalidUri) {
            logger.debug("Ignoring malformed embed URL '{}'", value);
            return Optional.empty();
        }
    }

    private static String watchParameter(URI uri) {
        String query = uri.getRawQuery();
        if (query == null) {
            return "";
        }
        for (String parameter : query.split("&")) {
            if (parameter.startsWith("v=")) {
                return parameter.substring(2);
            }
        }
        return "";
    }
}

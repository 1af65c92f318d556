package com.williamcallahan.codelab.domain.codelab.node;

import com.williamcallahan.codelab.support.AsciiTextNormalizer;

import java.util.Optional;

/**
 * Tone of an infobox.
 */
public enum InfoboxKind {
    POSITIVE,
    NEGATIVE;

    /**
     * Resolves an infobox marker such as {@code Positive} or {@code negative}.
     *
     * @param marker marker text
     * @return matching kind, empty when the text is not a marker
     */
    public static Optional<InfoboxKind> fromMarker(String marker) {
        String normalized = AsciiTextNormalizer.toLowerAscii(marker).trim();
        return switch (normalized) {
            case "positive" -> Optional.of(POSITIVE);
            case "negative" -> Optional.of(NEGATIVE);
            default -> Optional.empty();
        };
    }
}

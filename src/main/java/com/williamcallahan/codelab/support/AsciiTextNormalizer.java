package com.williamcallahan.codelab.support;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Locale-independent text normalization for tags, metadata keys and anchors.
 *
 * Only ASCII uppercase letters (A-Z) are lowercased so that tag comparison never depends on the
 * default locale. Typographic punctuation produced by the markdown renderer is folded back to
 * ASCII before any text is compared or emitted.
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private static final Map<Character, String> TYPOGRAPHY = Map.of(
        '\u2019', "'",
        '\u2018', "'",
        '\u201C', "\"",
        '\u201D', "\"",
        '\u2026', "...",
        '\u00A0', " ",
        '\u0085', " "
    );

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Replaces smart quotes, ellipsis and non-breaking spaces with their ASCII forms.
     *
     * @param text text possibly produced by typographic rendering (may be null)
     * @return ASCII-folded text, or empty string if null
     */
    public static String cleanTypography(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder cleaned = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            String replacement = TYPOGRAPHY.get(current);
            if (replacement != null) {
                cleaned.append(replacement);
            } else {
                cleaned.append(current);
            }
        }
        return cleaned.toString();
    }

    /**
     * Splits a comma-separated value, trimming and case-folding every element.
     * Empty elements are dropped and duplicates keep their first position.
     *
     * @param value comma-separated list
     * @return normalized elements
     */
    public static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        LinkedHashSet<String> elements = new LinkedHashSet<>();
        for (String part : value.split(",")) {
            String normalized = toLowerAscii(part.trim());
            if (!normalized.isEmpty()) {
                elements.add(normalized);
            }
        }
        return new ArrayList<>(elements);
    }

    /**
     * Converts arbitrary text to a slug: lowercase ASCII letters and digits, with every run of
     * other characters collapsed into a single hyphen and no leading or trailing hyphen.
     *
     * @param text text to convert (may be null)
     * @return slug, possibly empty
     */
    public static String slugify(String text) {
        String lower = toLowerAscii(text);
        StringBuilder slug = new StringBuilder(lower.length());
        boolean pendingDash = false;
        for (int index = 0; index < lower.length(); index++) {
            char current = lower.charAt(index);
            boolean alphanumeric = (current >= 'a' && current <= 'z') || (current >= '0' && current <= '9');
            if (!alphanumeric) {
                pendingDash = slug.length() > 0;
                continue;
            }
            if (pendingDash) {
                slug.append('-');
                pendingDash = false;
            }
            slug.append(current);
        }
        return slug.toString();
    }
}

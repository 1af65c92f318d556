package com.williamcallahan.codelab.domain.codelab;

import com.williamcallahan.codelab.support.AsciiTextNormalizer;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-call parser options.
 *
 * @param passMetadata metadata keys copied verbatim into {@link Codelab#getExtra()}
 */
public record ParseOptions(Set<String> passMetadata) {

    public ParseOptions {
        passMetadata = passMetadata == null ? Set.of() : Set.copyOf(passMetadata);
    }

    /**
     * Creates options that keep no extra metadata.
     *
     * @return default options
     */
    public static ParseOptions defaults() {
        return new ParseOptions(Set.of());
    }

    /**
     * Creates options from raw metadata keys, case-folding and trimming them.
     *
     * @param keys metadata keys to pass through
     * @return options
     */
    public static ParseOptions passing(Collection<String> keys) {
        if (keys == null) {
            return defaults();
        }
        return new ParseOptions(keys.stream()
            .map(key -> AsciiTextNormalizer.toLowerAscii(key).trim())
            .filter(key -> !key.isEmpty())
            .collect(Collectors.toSet()));
    }

    public boolean passes(String key) {
        return passMetadata.contains(key);
    }
}

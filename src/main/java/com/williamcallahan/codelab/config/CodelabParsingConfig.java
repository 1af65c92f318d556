package com.williamcallahan.codelab.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Codelab parsing settings.
 */
public class CodelabParsingConfig {

    private static final List<String> IFRAME_ALLOWLIST_DEF = List.of(
            "carto.com",
            "codepen.io",
            "dartlang.org",
            "dartpad.dev",
            "github.com",
            "glitch.com",
            "google.com",
            "google.dev",
            "observablehq.com",
            "repl.it",
            "web.dev");
    private static final List<String> CONSOLE_LANGUAGES_DEF = List.of("console");
    private static final String PASS_METADATA_KEY = "app.parser.pass-metadata";
    private static final String IFRAME_ALLOWLIST_KEY = "app.parser.iframe-allowlist";
    private static final String CONSOLE_LANGUAGES_KEY = "app.parser.console-languages";
    private static final String NOT_NULL_FMT = "%s must be set.";
    private static final String BLANK_ENTRY_FMT = "%s must not contain blank entries (index %d).";
    private static final String NOT_EMPTY_FMT = "%s must declare at least one entry.";

    private List<String> passMetadata = new ArrayList<>();
    private List<String> iframeAllowlist = new ArrayList<>(IFRAME_ALLOWLIST_DEF);
    private List<String> consoleLanguages = new ArrayList<>(CONSOLE_LANGUAGES_DEF);

    /**
     * Creates codelab parsing configuration.
     */
    public CodelabParsingConfig() {}

    /**
     * Validates parsing settings.
     */
    public void validateConfiguration() {
        requireEntries(PASS_METADATA_KEY, passMetadata, false);
        requireEntries(IFRAME_ALLOWLIST_KEY, iframeAllowlist, false);
        requireEntries(CONSOLE_LANGUAGES_KEY, consoleLanguages, true);
    }

    /**
     * Returns the metadata keys copied into a codelab's extra attributes.
     *
     * @return metadata keys passed through
     */
    public List<String> getPassMetadata() {
        return passMetadata;
    }

    /**
     * Sets the metadata keys copied into a codelab's extra attributes.
     *
     * @param passMetadata metadata keys passed through
     */
    public void setPassMetadata(final List<String> passMetadata) {
        this.passMetadata = passMetadata;
    }

    /**
     * Returns the domains whose URLs may be embedded as frames.
     *
     * @return allow-listed frame domains
     */
    public List<String> getIframeAllowlist() {
        return iframeAllowlist;
    }

    /**
     * Sets the domains whose URLs may be embedded as frames.
     *
     * @param iframeAllowlist allow-listed frame domains
     */
    public void setIframeAllowlist(final List<String> iframeAllowlist) {
        this.iframeAllowlist = iframeAllowlist;
    }

    /**
     * Returns the fenced-code languages rendered as console sessions.
     *
     * @return console languages
     */
    public List<String> getConsoleLanguages() {
        return consoleLanguages;
    }

    /**
     * Sets the fenced-code languages rendered as console sessions.
     *
     * @param consoleLanguages console languages
     */
    public void setConsoleLanguages(final List<String> consoleLanguages) {
        this.consoleLanguages = consoleLanguages;
    }

    private void requireEntries(final String propertyKey, final List<String> entries, final boolean nonEmpty) {
        if (entries == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NOT_NULL_FMT, propertyKey));
        }
        if (nonEmpty && entries.isEmpty()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NOT_EMPTY_FMT, propertyKey));
        }
        for (int index = 0; index < entries.size(); index++) {
            String entry = entries.get(index);
            if (entry == null || entry.isBlank()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_ENTRY_FMT, propertyKey, index));
            }
        }
    }
}

package com.williamcallahan.codelab.service.codelab;

/**
 * Named fatal conditions of a codelab parse. Everything else degrades silently.
 */
public enum ParseFailure {
    /**
     * The markup tree has no body element.
     */
    MISSING_BODY("document without a body"),

    /**
     * The metadata paragraph does not declare a non-empty id.
     */
    MISSING_METADATA_ID("invalid metadata format, missing at least id"),

    /**
     * A fragment declares a level-1 or level-2 heading.
     */
    FRAGMENT_STEPS_FORBIDDEN("defining steps in a fragment is forbidden"),

    /**
     * A fragment contains an import directive.
     */
    FRAGMENT_IMPORTS_FORBIDDEN("importing content in a fragment is forbidden"),

    /**
     * The markdown renderer or the tree builder failed.
     */
    RENDER_FAILED("markdown rendering failed");

    private final String description;

    ParseFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}

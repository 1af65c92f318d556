package com.williamcallahan.codelab.domain.codelab.node;

/**
 * Closed set of content node kinds produced by the codelab parser.
 *
 * <p>Header and list kinds carry their checklist and FAQ flavors as distinct constants so that
 * renderers can switch on the kind alone.</p>
 */
public enum NodeKind {
    TEXT,
    CODE,
    LINK,
    BUTTON,
    IMAGE,
    YOUTUBE,
    IFRAME,
    HEADER,
    HEADER_CHECKLIST,
    HEADER_FAQ,
    ITEMS_LIST,
    ITEMS_CHECKLIST,
    ITEMS_FAQ,
    INFOBOX,
    GRID,
    SURVEY,
    IMPORT,
    BLOCK;

    /**
     * Reports whether this kind is one of the header flavors.
     *
     * @return true for plain, checklist and FAQ headers
     */
    public boolean isHeader() {
        return this == HEADER || this == HEADER_CHECKLIST || this == HEADER_FAQ;
    }
}

package com.williamcallahan.codelab.domain.codelab.node;

import java.util.Objects;

/**
 * A reference to another codelab document. The referenced content is never inlined.
 */
public final class ImportNode extends CodelabNode {

    private final String url;

    public ImportNode(String url) {
        super(NodeKind.IMPORT);
        this.url = Objects.requireNonNull(url, "Import URL cannot be null");
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean isEmpty() {
        return url.isEmpty();
    }
}

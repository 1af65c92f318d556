package com.williamcallahan.codelab.domain.codelab.node;

import java.util.Objects;

/**
 * An embedded frame pointing at an allow-listed https URL.
 */
public final class IframeNode extends CodelabNode {

    private final String url;

    public IframeNode(String url) {
        super(NodeKind.IFRAME);
        this.url = Objects.requireNonNull(url, "Frame URL cannot be null");
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean isEmpty() {
        return url.isEmpty();
    }
}

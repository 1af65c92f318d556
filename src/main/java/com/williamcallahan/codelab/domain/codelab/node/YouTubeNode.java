package com.williamcallahan.codelab.domain.codelab.node;

import java.util.Objects;

/**
 * An embedded YouTube video.
 */
public final class YouTubeNode extends CodelabNode {

    private final String videoId;

    public YouTubeNode(String videoId) {
        super(NodeKind.YOUTUBE);
        this.videoId = Objects.requireNonNull(videoId, "Video id cannot be null");
    }

    public String getVideoId() {
        return videoId;
    }

    @Override
    public boolean isEmpty() {
        return videoId.isEmpty();
    }
}

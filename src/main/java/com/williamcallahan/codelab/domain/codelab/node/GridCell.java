package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;
import java.util.Objects;

/**
 * One table cell with its spans and block-grouped content.
 *
 * @param colspan number of columns covered, at least 1
 * @param rowspan number of rows covered, at least 1
 * @param content cell content
 */
public record GridCell(int colspan, int rowspan, List<CodelabNode> content) {

    public GridCell {
        if (colspan < 1) {
            throw new IllegalArgumentException("Cell colspan must be at least 1");
        }
        if (rowspan < 1) {
            throw new IllegalArgumentException("Cell rowspan must be at least 1");
        }
        Objects.requireNonNull(content, "Cell content cannot be null");
        content = List.copyOf(content);
    }
}

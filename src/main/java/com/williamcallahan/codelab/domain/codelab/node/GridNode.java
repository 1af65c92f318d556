package com.williamcallahan.codelab.domain.codelab.node;

import java.util.List;

/**
 * A table, as rows of cells.
 */
public final class GridNode extends CodelabNode {

    private final List<List<GridCell>> rows;

    public GridNode(List<List<GridCell>> rows) {
        super(NodeKind.GRID);
        this.rows = rows.stream().map(List::copyOf).toList();
    }

    public List<List<GridCell>> getRows() {
        return rows;
    }

    @Override
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

package com.excelgrid.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive rectangle of cells. Corners are normalized per axis,
 * so "D4:B2" and "B2:D4" describe the same range.
 */
public final class CellRange {

    private final CellAddress topLeft;
    private final CellAddress bottomRight;

    public CellRange(CellAddress first, CellAddress second) {
        this.topLeft = CellAddress.of(
                Math.min(first.getRow(), second.getRow()),
                Math.min(first.getCol(), second.getCol()));
        this.bottomRight = CellAddress.of(
                Math.max(first.getRow(), second.getRow()),
                Math.max(first.getCol(), second.getCol()));
    }

    public CellAddress getTopLeft() {
        return topLeft;
    }

    public CellAddress getBottomRight() {
        return bottomRight;
    }

    /**
     * Addresses of the range that also lie inside a rows x cols grid, row-major.
     */
    public List<CellAddress> addressesWithin(int rows, int cols) {
        List<CellAddress> result = new ArrayList<>();
        int lastRow = Math.min(bottomRight.getRow(), rows - 1);
        int lastCol = Math.min(bottomRight.getCol(), cols - 1);
        for (int r = topLeft.getRow(); r <= lastRow; r++) {
            for (int c = topLeft.getCol(); c <= lastCol; c++) {
                result.add(CellAddress.of(r, c));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return topLeft.toLabel() + ":" + bottomRight.toLabel();
    }
}

package com.excelgrid.app.models;

import com.excelgrid.app.formula.CellAddressCodec;

import java.util.Objects;

/**
 * Zero-based (row, column) coordinate of a cell.
 * Immutable; equal addresses are interchangeable as map keys.
 */
public final class CellAddress {

    private final int row;
    private final int col;

    public CellAddress(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Negative cell coordinate: (" + row + ", " + col + ")");
        }
        this.row = row;
        this.col = col;
    }

    public static CellAddress of(int row, int col) {
        return new CellAddress(row, col);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Spreadsheet label, e.g. (11, 1) -> "B12".
     */
    public String toLabel() {
        return CellAddressCodec.format(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return toLabel();
    }
}

package com.excelgrid.app.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rectangular cell storage: the raw text the host typed and the
 * evaluated value of each cell, kept at identical dimensions.
 * A null evaluated slot means "not evaluated yet in this pass".
 */
public class Grid {

    private final int rows;
    private final int cols;
    private final String[][] raw;
    private final CellValue[][] evaluated;

    public Grid(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative grid dimensions: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.raw = new String[rows][cols];
        this.evaluated = new CellValue[rows][cols];
        for (String[] row : raw) {
            Arrays.fill(row, "");
        }
    }

    /**
     * Builds a grid from row-major raw data. Shorter rows are padded
     * with blank cells up to the widest row; null cells become blank.
     */
    public static Grid fromRows(List<? extends List<String>> data) {
        int width = 0;
        for (List<String> row : data) {
            width = Math.max(width, row == null ? 0 : row.size());
        }
        Grid grid = new Grid(data.size(), width);
        for (int r = 0; r < data.size(); r++) {
            List<String> row = data.get(r);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < row.size(); c++) {
                grid.setRaw(CellAddress.of(r, c), row.get(c));
            }
        }
        return grid;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public boolean contains(CellAddress address) {
        return address.getRow() < rows && address.getCol() < cols;
    }

    public String getRaw(CellAddress address) {
        checkBounds(address);
        return raw[address.getRow()][address.getCol()];
    }

    public void setRaw(CellAddress address, String value) {
        checkBounds(address);
        raw[address.getRow()][address.getCol()] = value == null ? "" : value;
    }

    public CellValue getEvaluated(CellAddress address) {
        checkBounds(address);
        return evaluated[address.getRow()][address.getCol()];
    }

    public void setEvaluated(CellAddress address, CellValue value) {
        checkBounds(address);
        evaluated[address.getRow()][address.getCol()] = value;
    }

    public boolean isEvaluated(CellAddress address) {
        return getEvaluated(address) != null;
    }

    /**
     * Marks every cell as not yet evaluated.
     */
    public void clearEvaluated() {
        for (CellValue[] row : evaluated) {
            Arrays.fill(row, null);
        }
    }

    /**
     * All addresses in row-major order.
     */
    public List<CellAddress> addresses() {
        List<CellAddress> result = new ArrayList<>(rows * cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                result.add(CellAddress.of(r, c));
            }
        }
        return result;
    }

    public List<List<String>> copyRaw() {
        List<List<String>> copy = new ArrayList<>(rows);
        for (String[] row : raw) {
            copy.add(new ArrayList<>(List.of(row)));
        }
        return copy;
    }

    public List<List<CellValue>> copyEvaluated() {
        List<List<CellValue>> copy = new ArrayList<>(rows);
        for (CellValue[] row : evaluated) {
            List<CellValue> values = new ArrayList<>(cols);
            for (CellValue value : row) {
                values.add(value == null ? CellValue.BLANK : value);
            }
            copy.add(values);
        }
        return copy;
    }

    private void checkBounds(CellAddress address) {
        if (!contains(address)) {
            throw new IndexOutOfBoundsException(
                    "Cell " + address + " is outside the " + rows + "x" + cols + " grid");
        }
    }
}

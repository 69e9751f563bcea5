package com.excelgrid.app.formula;

import com.excelgrid.app.models.CellValue;

/**
 * Looks up the current value of a referenced cell while a formula runs.
 */
@FunctionalInterface
public interface CellResolver {

    /**
     * @return the cell's value, or null when the label names no cell of the grid
     */
    CellValue resolve(String label);
}

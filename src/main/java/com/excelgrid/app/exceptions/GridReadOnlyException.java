package com.excelgrid.app.exceptions;

/**
 * Thrown when writing to a grid that was created read-only.
 */
public class GridReadOnlyException extends RuntimeException {
    public GridReadOnlyException(String message) {
        super(message);
    }
}

package com.excelgrid.app.exceptions;

/**
 * Thrown when a bound of a SUM range is not a valid cell label.
 */
public class InvalidRangeException extends FormulaException {
    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}

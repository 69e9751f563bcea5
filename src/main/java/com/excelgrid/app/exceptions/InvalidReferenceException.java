package com.excelgrid.app.exceptions;

/**
 * Thrown when a string is not a cell label such as "A1" or "AB12".
 */
public class InvalidReferenceException extends FormulaException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}

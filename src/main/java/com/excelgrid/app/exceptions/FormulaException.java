package com.excelgrid.app.exceptions;

/**
 * Base of everything that can go wrong while reading or evaluating
 * one formula. Caught at the cell boundary and turned into "#ERROR".
 */
public class FormulaException extends RuntimeException {
    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.excelgrid.app.exceptions;

/**
 * Thrown when formula text cannot be tokenized or its parentheses
 * do not balance (e.g. "=2+$" or "=(1+2").
 */
public class FormulaSyntaxException extends FormulaException {
    public FormulaSyntaxException(String message) {
        super(message);
    }

    public FormulaSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.excelgrid.app.exceptions;

/**
 * Thrown while running a postfix expression: missing or extra operands,
 * a non-numeric or errored operand, an unresolvable reference,
 * or division by zero.
 */
public class EvaluationException extends FormulaException {
    public EvaluationException(String message) {
        super(message);
    }
}

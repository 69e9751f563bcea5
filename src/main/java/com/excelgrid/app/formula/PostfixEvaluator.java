package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.EvaluationException;
import com.excelgrid.app.models.CellValue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Stack machine over a postfix token list.
 * Cell references are read through a CellResolver; errored or missing
 * cells fail the whole expression. Blank cells read as 0.
 */
public class PostfixEvaluator {

    public double evaluate(List<Token> postfix, CellResolver resolver) {
        Deque<Double> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            switch (token.getType()) {
                case NUMBER:
                    stack.push(token.getNumber());
                    break;
                case CELL_REF:
                    stack.push(readOperand(token.getText(), resolver));
                    break;
                case OPERATOR:
                    if (stack.size() < 2) {
                        throw new EvaluationException("Invalid expression: operator '"
                                + token.getText() + "' is missing an operand");
                    }
                    double right = stack.pop();
                    double left = stack.pop();
                    stack.push(apply(token.getOperator(), left, right));
                    break;
                default:
                    throw new EvaluationException("Unexpected token in postfix expression: " + token);
            }
        }

        if (stack.size() != 1) {
            throw new EvaluationException("Invalid expression: " + stack.size() + " values left on the stack");
        }
        return stack.pop();
    }

    private double readOperand(String label, CellResolver resolver) {
        CellValue value = resolver.resolve(label);
        if (value == null) {
            throw new EvaluationException("Cell " + label + " not found");
        }
        switch (value.getKind()) {
            case NUMBER:
                return value.getNumber();
            case BLANK:
                return 0d;
            case ERROR:
                throw new EvaluationException("Cell " + label + " has error: " + value.getError().getCode());
            default:
                throw new EvaluationException("Cell " + label + " is not numeric: " + value);
        }
    }

    private double apply(char operator, double left, double right) {
        switch (operator) {
            case '+':
                return left + right;
            case '-':
                return left - right;
            case '*':
                return left * right;
            case '/':
                if (right == 0d) {
                    throw new EvaluationException("Division by zero");
                }
                return left / right;
            default:
                throw new EvaluationException("Unknown operator: " + operator);
        }
    }
}

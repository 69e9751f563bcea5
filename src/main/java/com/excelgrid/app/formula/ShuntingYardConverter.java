package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.FormulaSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Infix to postfix conversion (Dijkstra's shunting-yard).
 * All operators are left-associative.
 */
public class ShuntingYardConverter {

    public List<Token> toPostfix(Iterable<Token> infix) {
        List<Token> output = new ArrayList<>();
        Deque<Token> operators = new ArrayDeque<>();

        for (Token token : infix) {
            switch (token.getType()) {
                case NUMBER:
                case CELL_REF:
                    output.add(token);
                    break;
                case OPERATOR:
                    while (!operators.isEmpty()
                            && operators.peek().getType() == TokenType.OPERATOR
                            && operators.peek().precedence() >= token.precedence()) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                    break;
                case LEFT_PAREN:
                    operators.push(token);
                    break;
                case RIGHT_PAREN:
                    while (!operators.isEmpty() && operators.peek().getType() != TokenType.LEFT_PAREN) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new FormulaSyntaxException("mismatched parentheses");
                    }
                    operators.pop();
                    break;
            }
        }

        while (!operators.isEmpty()) {
            Token op = operators.pop();
            if (op.getType() == TokenType.LEFT_PAREN) {
                throw new FormulaSyntaxException("mismatched parentheses");
            }
            output.add(op);
        }
        return output;
    }
}

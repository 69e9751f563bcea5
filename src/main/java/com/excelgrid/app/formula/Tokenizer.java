package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexes a formula body (without the leading '=') into tokens.
 * - whitespace is skipped
 * - a cell reference is a run of A-Z followed by a run of digits
 * - a number is a run of digits and '.' forming one literal
 * - + - * / ( ) are single-character tokens
 * Anything else is a FormulaSyntaxException. There is no unary minus.
 */
public class Tokenizer {

    /**
     * Lazily scans 'body'; errors surface when the offending token is reached.
     */
    public Iterable<Token> tokens(String body) {
        return () -> new TokenIterator(body);
    }

    public List<Token> tokenize(String body) {
        List<Token> result = new ArrayList<>();
        for (Token token : tokens(body)) {
            result.add(token);
        }
        return result;
    }

    private static final class TokenIterator implements Iterator<Token> {
        private final String input;
        private int pos;

        private TokenIterator(String input) {
            this.input = input;
        }

        @Override
        public boolean hasNext() {
            skipWhitespace();
            return pos < input.length();
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            char c = input.charAt(pos);
            switch (c) {
                case '+':
                case '-':
                case '*':
                case '/':
                    pos++;
                    return Token.operator(c);
                case '(':
                    pos++;
                    return Token.LEFT_PAREN;
                case ')':
                    pos++;
                    return Token.RIGHT_PAREN;
                default:
                    break;
            }
            if (isLetter(c)) {
                return readCellRef();
            }
            if (isDigit(c)) {
                return readNumber();
            }
            throw new FormulaSyntaxException("Unexpected character '" + c + "' at position " + pos);
        }

        private Token readCellRef() {
            int start = pos;
            while (pos < input.length() && isLetter(input.charAt(pos))) {
                pos++;
            }
            int digitsStart = pos;
            while (pos < input.length() && isDigit(input.charAt(pos))) {
                pos++;
            }
            if (pos == digitsStart) {
                throw new FormulaSyntaxException(
                        "Expected row number after '" + input.substring(start, pos) + "'");
            }
            return Token.cellRef(input.substring(start, pos));
        }

        private Token readNumber() {
            int start = pos;
            while (pos < input.length() && (isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                pos++;
            }
            String literal = input.substring(start, pos);
            try {
                return Token.number(Double.parseDouble(literal));
            } catch (NumberFormatException e) {
                throw new FormulaSyntaxException("Invalid number: " + literal, e);
            }
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private static boolean isLetter(char c) {
            return c >= 'A' && c <= 'Z';
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }
    }
}

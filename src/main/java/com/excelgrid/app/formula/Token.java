package com.excelgrid.app.formula;

import java.util.Objects;

/**
 * One lexical unit of a formula body.
 * 'text' carries the label for CELL_REF and the symbol for OPERATOR;
 * 'number' is only meaningful for NUMBER.
 */
public final class Token {

    public static final Token LEFT_PAREN = new Token(TokenType.LEFT_PAREN, "(", 0d);
    public static final Token RIGHT_PAREN = new Token(TokenType.RIGHT_PAREN, ")", 0d);

    private final TokenType type;
    private final String text;
    private final double number;

    private Token(TokenType type, String text, double number) {
        this.type = type;
        this.text = text;
        this.number = number;
    }

    public static Token number(double value) {
        return new Token(TokenType.NUMBER, String.valueOf(value), value);
    }

    public static Token cellRef(String label) {
        return new Token(TokenType.CELL_REF, label, 0d);
    }

    public static Token operator(char symbol) {
        return new Token(TokenType.OPERATOR, String.valueOf(symbol), 0d);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public double getNumber() {
        return number;
    }

    public char getOperator() {
        return text.charAt(0);
    }

    /**
     * Binding strength of an operator: '*' and '/' bind tighter than '+' and '-'.
     */
    public int precedence() {
        switch (getOperator()) {
            case '*':
            case '/':
                return 2;
            case '+':
            case '-':
                return 1;
            default:
                throw new IllegalStateException("Not an operator: " + text);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}

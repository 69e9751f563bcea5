package com.excelgrid.app.formula;

public enum TokenType {
    NUMBER,
    CELL_REF,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
}

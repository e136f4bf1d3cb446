package com.spreadsheet.engine.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    CELL_REF,
    SHEET_PREFIX,
    FUNCTION_NAME,
    NAME,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    PERCENT,
    AMPERSAND,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}

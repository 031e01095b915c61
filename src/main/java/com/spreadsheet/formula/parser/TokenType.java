package com.spreadsheet.formula.parser;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    CELL,
    RANGE,
    FUNCTION
}

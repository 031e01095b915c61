package com.spreadsheet.formula.parser;

import java.util.Objects;

/**
 * One lexical unit of a formula. For CELL, RANGE, FUNCTION and BOOLEAN
 * the text is already uppercased; STRING text excludes the quotes.
 */
public final class Token {
    private final TokenType type;
    private final String text;

    public Token(TokenType type, String text) {
        this.type = type;
        this.text = text;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
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
        return type == other.type && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return type + "[" + text + "]";
    }
}

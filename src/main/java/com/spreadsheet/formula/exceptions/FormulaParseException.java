package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a token stream doesn't form a valid formula
 * (unexpected token, missing parenthesis, unexpected end of input).
 * No position is tracked; the message names the offending token.
 */
public class FormulaParseException extends FormulaException {
    public FormulaParseException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "PARSE_ERROR";
    }
}

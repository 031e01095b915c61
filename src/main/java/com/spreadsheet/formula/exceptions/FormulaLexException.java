package com.spreadsheet.formula.exceptions;

/**
 * Thrown by the tokenizer on a character (or character run) that
 * can't start any token, e.g. "=1 $ 2" or an unterminated string.
 */
public class FormulaLexException extends FormulaParseException {
    public FormulaLexException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "LEX_ERROR";
    }
}

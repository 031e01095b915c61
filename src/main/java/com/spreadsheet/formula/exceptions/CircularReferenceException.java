package com.spreadsheet.formula.exceptions;

/**
 * Thrown when evaluating a formula would read its own result,
 * either directly (A1 = "=A1") or through a multi-cell loop.
 */
public class CircularReferenceException extends FormulaException {
    public CircularReferenceException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "CIRCULAR_REFERENCE";
    }
}

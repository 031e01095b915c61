package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a range value escapes a function argument list,
 * e.g. "=A1:A3" or "=A1:A2+1".
 */
public class InvalidRangeUsageException extends FormulaException {
    public InvalidRangeUsageException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_RANGE_USAGE";
    }
}

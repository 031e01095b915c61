package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a formula calls a function name that isn't registered.
 */
public class UnknownFunctionException extends FormulaException {
    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
    }

    @Override
    public String getErrorCode() {
        return "UNKNOWN_FUNCTION";
    }
}

package com.spreadsheet.formula.exceptions;

/**
 * Base type for every error that aborts a formula evaluation.
 * Each subtype carries a stable error code, used both in REST error
 * responses and in the "#ERROR:" marker a failing cell displays.
 */
public abstract class FormulaException extends RuntimeException {

    protected FormulaException(String message) {
        super(message);
    }

    public abstract String getErrorCode();
}

package com.spreadsheet.formula.exceptions;

public class DivisionByZeroException extends FormulaException {
    public DivisionByZeroException() {
        super("Division by zero");
    }

    @Override
    public String getErrorCode() {
        return "DIVISION_BY_ZERO";
    }
}

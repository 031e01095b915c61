package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a caller addresses a cell with text that isn't
 * A1 syntax, for example "/sheet/1/cell/1A".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}

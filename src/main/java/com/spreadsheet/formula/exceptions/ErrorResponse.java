package com.spreadsheet.formula.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "DIVISION_BY_ZERO",
 *   "message": "Division by zero"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

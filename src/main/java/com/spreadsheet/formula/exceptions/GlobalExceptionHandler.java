package com.spreadsheet.formula.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches exceptions from the controllers and services, returning
 * error JSON with an HTTP 4xx code instead of 500 where the caller is at fault.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Every formula failure (syntax, cycle, unknown function, ...) carries its own code.
     */
    @ExceptionHandler(FormulaException.class)
    public ResponseEntity<ErrorResponse> handleFormula(FormulaException ex) {
        ErrorResponse error = new ErrorResponse(ex.getErrorCode(), ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidCellReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidCellReferenceException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_CELL_REFERENCE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}

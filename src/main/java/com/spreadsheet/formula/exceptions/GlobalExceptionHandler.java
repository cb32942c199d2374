package com.spreadsheet.formula.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches host-level exceptions from the controllers or services,
 * returning user-friendly error JSON with an HTTP 4xx code instead of 500.
 * Formula errors never get here; they are returned as cell results.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        ErrorResponse error = new ErrorResponse(ErrorResponse.SHEET_NOT_FOUND, ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidCellReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCellReference(InvalidCellReferenceException ex) {
        ErrorResponse error = new ErrorResponse(ErrorResponse.INVALID_CELL_REFERENCE, ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidAxisException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAxis(InvalidAxisException ex) {
        ErrorResponse error = new ErrorResponse(ErrorResponse.INVALID_AXIS, ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Anything else is a bug on our side, so keep the stack trace
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse(ErrorResponse.SERVER_ERROR, ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}

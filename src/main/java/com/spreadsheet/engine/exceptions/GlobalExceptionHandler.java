package com.spreadsheet.engine.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns engine exceptions thrown from controllers or services into
 * error JSON with a 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex) {
        return respond("INVALID_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({FormulaParseException.class, InvalidFormulaException.class})
    public ResponseEntity<ErrorResponse> handleInvalidFormula(SpreadsheetException ex) {
        return respond("INVALID_FORMULA", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidAddressException ex) {
        return respond("INVALID_ADDRESS", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRange(InvalidRangeException ex) {
        return respond("INVALID_RANGE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CircularDependencyException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularDependencyException ex) {
        return respond("CIRCULAR_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidOperationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOperation(InvalidOperationException ex) {
        return respond("INVALID_OPERATION", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(BatchNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleBatchNotFound(BatchNotFoundException ex) {
        return respond("BATCH_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return respond("SHEET_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    // Unreadable JSON bodies, including unknown fill directions
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond("INVALID_OPERATION", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions
        logger.error("Unhandled error", ex);
        return respond("SERVER_ERROR", ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> respond(String code, RuntimeException ex, HttpStatus status) {
        return new ResponseEntity<>(new ErrorResponse(code, ex.getMessage()), status);
    }
}

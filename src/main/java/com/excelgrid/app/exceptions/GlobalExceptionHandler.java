package com.excelgrid.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Turns host-level exceptions into error JSON with a 4xx code.
 * Formula failures never get here; they are stored in the cell as "#ERROR".
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GridNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleGridNotFound(GridNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("GRID_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_REFERENCE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidGridException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGrid(InvalidGridException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_GRID", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(GridReadOnlyException.class)
    public ResponseEntity<ErrorResponse> handleReadOnly(GridReadOnlyException ex) {
        ErrorResponse error = new ErrorResponse("GRID_READ_ONLY", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}

package com.formulagrid.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps exceptions from the controllers and services to an {@link ErrorResponse}:
 * bad input is a 400, unknown workbooks, tables and cells are a 404.
 * Formula failures never get here; they are rendered on the cell itself.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidAddressException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_ADDRESS", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(IllegalArgumentException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_INPUT", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("WORKBOOK_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(TableNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTableNotFound(TableNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("TABLE_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CellNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCellNotFound(CellNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("CELL_NOT_FOUND", ex.getMessage(),
                ex.getTableId() + "!" + ex.getAddress());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions you haven't explicitly handled
        log.warn("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}

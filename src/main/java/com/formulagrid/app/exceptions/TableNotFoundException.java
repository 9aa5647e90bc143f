package com.formulagrid.app.exceptions;

/**
 * Thrown when a table ID is not part of the requested workbook.
 */
public class TableNotFoundException extends RuntimeException {
    public TableNotFoundException(String message) {
        super(message);
    }
}

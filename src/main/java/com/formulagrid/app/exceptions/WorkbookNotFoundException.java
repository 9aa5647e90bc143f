package com.formulagrid.app.exceptions;

/**
 * Thrown when attempting to access a workbook ID
 * that doesn't exist in the in-memory store.
 */
public class WorkbookNotFoundException extends RuntimeException {
    public WorkbookNotFoundException(String message) {
        super(message);
    }
}

package com.formulagrid.app.exceptions;

/**
 * Thrown when a formula cell fails to evaluate.
 * Carries the address of the cell where the failure originated
 * (e.g. "t1!B4") and the underlying {@link ErrorKind}.
 * Dependent cells re-throw the same instance, so the originating address survives.
 */
public class CellEvaluationException extends RuntimeException {
    private final String cellKey;
    private final ErrorKind kind;

    public CellEvaluationException(String cellKey, ErrorKind kind, String message) {
        super(message);
        this.cellKey = cellKey;
        this.kind = kind;
    }

    public CellEvaluationException(String cellKey, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.cellKey = cellKey;
        this.kind = kind;
    }

    public String getCellKey() {
        return cellKey;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

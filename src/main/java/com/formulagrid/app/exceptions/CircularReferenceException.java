package com.formulagrid.app.exceptions;

/**
 * Thrown when evaluating a formula re-enters a cell that is already being
 * calculated, e.g. a cell referencing itself or a multi-cell loop.
 * The loop may span several tables as long as they share one evaluation context.
 */
public class CircularReferenceException extends CellEvaluationException {
    public CircularReferenceException(String cellKey, String message) {
        super(cellKey, ErrorKind.CIRCULAR_DEPENDENCY, message);
    }
}

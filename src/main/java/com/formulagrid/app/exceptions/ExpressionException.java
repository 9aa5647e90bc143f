package com.formulagrid.app.exceptions;

/**
 * Thrown by the expression interpreter when fully-substituted formula text
 * uses a construct outside the allowed grammar, or when an allowed
 * function or operator fails at runtime (wrong argument count, bad type,
 * division by zero...).
 * It carries no cell address; the formula cell wraps it into a
 * {@link CellEvaluationException}.
 */
public class ExpressionException extends RuntimeException {
    private final ErrorKind kind;

    public ExpressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static ExpressionException unsupported(String message) {
        return new ExpressionException(ErrorKind.UNSUPPORTED_EXPRESSION, message);
    }

    public static ExpressionException failed(String message) {
        return new ExpressionException(ErrorKind.EVALUATION_ERROR, message);
    }

    public ErrorKind getKind() {
        return kind;
    }
}

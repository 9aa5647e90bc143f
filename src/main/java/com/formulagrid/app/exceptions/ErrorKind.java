package com.formulagrid.app.exceptions;

/**
 * Why a formula could not be evaluated.
 * Kept on every evaluation failure so callers can inspect it programmatically.
 */
public enum ErrorKind {
    SYNTAX_ERROR,
    CIRCULAR_DEPENDENCY,
    UNSUPPORTED_EXPRESSION,
    EVALUATION_ERROR,
    DANGLING_REFERENCE,
    DEPTH_LIMIT_EXCEEDED
}

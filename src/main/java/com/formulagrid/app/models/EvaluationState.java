package com.formulagrid.app.models;

/**
 * Lifecycle of a formula cell: PENDING -> CALCULATING -> COMPLETED | ERROR.
 */
public enum EvaluationState {
    PENDING,
    CALCULATING,
    COMPLETED,
    ERROR
}

package com.formulagrid.app.models;

/**
 * The three variants a table cell can be. Switch over this, never over instanceof.
 */
public enum CellKind {
    VALUE,
    FORMULA,
    REFERENCE
}

package com.formulagrid.app.models;

import com.formulagrid.app.services.EvaluationContext;

/**
 * A single cell owned by exactly one {@link Table}.
 * The hierarchy is closed: a cell is a {@link ValueCell}, a {@link FormulaCell}
 * or a {@link ReferenceCell}, as told by {@link #getKind()}.
 */
public abstract class Cell {
    private final Table table;
    private final CellAddress address;
    private final String id;

    // Package-private: only the three variants in this package may extend it
    Cell(Table table, CellAddress address, String id) {
        this.table = table;
        this.address = address;
        this.id = id;
    }

    public abstract CellKind getKind();

    /**
     * Returns this cell's value, computing it (and whatever it depends on) if needed.
     */
    public abstract Object evaluate(EvaluationContext context);

    /**
     * The value as it stands, without evaluating anything.
     * For a formula cell this is the cached result, or null before evaluation.
     */
    public abstract Object getValue();

    public Table getTable() {
        return table;
    }

    public CellAddress getAddress() {
        return address;
    }

    /** The upstream cell id, if one was supplied. */
    public String getId() {
        return id;
    }

    public CellKey getKey() {
        return new CellKey(table.getId(), address);
    }

    @Override
    public String toString() {
        return getKey().toString();
    }
}

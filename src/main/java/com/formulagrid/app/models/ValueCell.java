package com.formulagrid.app.models;

import com.formulagrid.app.services.EvaluationContext;

/**
 * A plain scalar: number, text, boolean, or null for a value-typed cell with no value.
 */
public final class ValueCell extends Cell {
    private final Object value;
    private final FormatType formatType;

    ValueCell(Table table, CellAddress address, String id, Object value, FormatType formatType) {
        super(table, address, id);
        this.value = value;
        this.formatType = formatType;
    }

    @Override
    public CellKind getKind() {
        return CellKind.VALUE;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return value;
    }

    @Override
    public Object getValue() {
        return value;
    }

    public FormatType getFormatType() {
        return formatType;
    }
}

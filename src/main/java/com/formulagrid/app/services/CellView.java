package com.formulagrid.app.services;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.formulagrid.app.exceptions.ErrorKind;
import com.formulagrid.app.models.CellKind;

/**
 * What a downstream renderer gets for one cell:
 * the address, the value to display, and depending on the kind
 * the "=expression" text or the "tableId!address" link target.
 * For example:
 * {
 *   "address": "B4",
 *   "kind": "FORMULA",
 *   "value": 1500,
 *   "formula": "=SUM(B2:B3)"
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellView {
    private final String address;
    private final CellKind kind;
    private final Object value;
    private final String formula;
    private final String target;
    private final String error;
    private final ErrorKind errorKind;

    public CellView(String address, CellKind kind, Object value, String formula, String target,
                    String error, ErrorKind errorKind) {
        this.address = address;
        this.kind = kind;
        this.value = value;
        this.formula = formula;
        this.target = target;
        this.error = error;
        this.errorKind = errorKind;
    }

    public String getAddress() {
        return address;
    }
    public CellKind getKind() {
        return kind;
    }
    public Object getValue() {
        return value;
    }
    public String getFormula() {
        return formula;
    }
    public String getTarget() {
        return target;
    }
    public String getError() {
        return error;
    }
    public ErrorKind getErrorKind() {
        return errorKind;
    }
}

package com.formulagrid.app.exceptions;

/**
 * Thrown when a caller asks for a cell that the table doesn't hold.
 * Formulas never raise it: a missing cell inside a formula is a dangling reference.
 */
public class CellNotFoundException extends RuntimeException {
    private final String tableId;
    private final String address;

    public CellNotFoundException(String tableId, String address) {
        super("Cell " + address + " not found in table " + tableId);
        this.tableId = tableId;
        this.address = address;
    }

    public String getTableId() {
        return tableId;
    }

    public String getAddress() {
        return address;
    }
}

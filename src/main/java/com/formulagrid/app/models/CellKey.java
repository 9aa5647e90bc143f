package com.formulagrid.app.models;

import java.util.Objects;

/**
 * Identifies one cell across all tables: table id plus address.
 * This is what the evaluation call stack holds, so loops between tables are caught.
 */
public final class CellKey {
    private final String tableId;
    private final CellAddress address;

    public CellKey(String tableId, CellAddress address) {
        this.tableId = Objects.requireNonNull(tableId, "tableId");
        this.address = Objects.requireNonNull(address, "address");
    }

    public String getTableId() {
        return tableId;
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellKey)) {
            return false;
        }
        CellKey that = (CellKey) o;
        return tableId.equals(that.tableId) && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, address);
    }

    @Override
    public String toString() {
        return tableId + "!" + address;
    }
}

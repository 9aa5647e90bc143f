package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A cross-table edge carried by a link cell:
 * which table, which cell, and optionally the sheet name the target is shown under.
 */
public class CellReference {
    @JsonProperty("table_id")
    private String tableId;

    @JsonProperty("cell_address")
    private String cellAddress;

    @JsonProperty("sheet_name")
    private String sheetName;

    // Default constructor needed for JSON (de)serialization
    public CellReference() {
    }

    public CellReference(String tableId, String cellAddress) {
        this(tableId, cellAddress, null);
    }

    public CellReference(String tableId, String cellAddress, String sheetName) {
        this.tableId = tableId;
        this.cellAddress = cellAddress;
        this.sheetName = sheetName;
    }

    public String getTableId() {
        return tableId;
    }
    public String getCellAddress() {
        return cellAddress;
    }
    public String getSheetName() {
        return sheetName;
    }
    public void setTableId(String tableId) {
        this.tableId = tableId;
    }
    public void setCellAddress(String cellAddress) {
        this.cellAddress = cellAddress;
    }
    public void setSheetName(String sheetName) {
        this.sheetName = sheetName;
    }

    /**
     * Fully-qualified target, always by table id: "t2!B2".
     */
    @JsonIgnore
    public String getTarget() {
        return tableId + "!" + cellAddress;
    }

    /**
     * "'Sheet name'!B2" when a sheet name is known, otherwise the same as {@link #getTarget()}.
     */
    @Override
    public String toString() {
        if (sheetName != null && !sheetName.isEmpty()) {
            return "'" + sheetName + "'!" + cellAddress;
        }
        return getTarget();
    }
}

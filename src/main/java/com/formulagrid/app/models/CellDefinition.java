package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One cell as the upstream data source delivers it:
 * position, cell_type, and whichever of value / formula / references applies.
 */
public class CellDefinition {
    private String id;
    private int row;
    private int column;

    @JsonProperty("cell_type")
    private CellType cellType;

    private Object value;
    private String formula;

    @JsonProperty("format_type")
    private FormatType formatType;

    @JsonAlias("reference")
    private List<CellReference> references = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public CellDefinition() {
    }

    public CellDefinition(int row, int column, CellType cellType) {
        this.row = row;
        this.column = column;
        this.cellType = cellType;
    }

    public static CellDefinition value(int row, int column, Object value) {
        CellDefinition cell = new CellDefinition(row, column, CellType.VALUE);
        cell.setValue(value);
        return cell;
    }

    public static CellDefinition formula(int row, int column, String formula) {
        CellDefinition cell = new CellDefinition(row, column, CellType.FORMULA);
        cell.setFormula(formula);
        return cell;
    }

    public static CellDefinition link(int row, int column, CellReference... references) {
        CellDefinition cell = new CellDefinition(row, column, CellType.LINK);
        cell.setReferences(new ArrayList<>(Arrays.asList(references)));
        return cell;
    }

    public static CellDefinition empty(int row, int column) {
        return new CellDefinition(row, column, CellType.EMPTY);
    }

    /**
     * Fluent variant of {@link #setFormatType(FormatType)} for building fixtures.
     */
    public CellDefinition withFormat(FormatType formatType) {
        this.formatType = formatType;
        return this;
    }

    public String getId() {
        return id;
    }
    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }
    public CellType getCellType() {
        return cellType;
    }
    public Object getValue() {
        return value;
    }
    public String getFormula() {
        return formula;
    }
    public FormatType getFormatType() {
        return formatType;
    }
    public List<CellReference> getReferences() {
        return references;
    }

    public void setId(String id) {
        this.id = id;
    }
    public void setRow(int row) {
        this.row = row;
    }
    public void setColumn(int column) {
        this.column = column;
    }
    public void setCellType(CellType cellType) {
        this.cellType = cellType;
    }
    public void setValue(Object value) {
        this.value = value;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setFormatType(FormatType formatType) {
        this.formatType = formatType;
    }
    public void setReferences(List<CellReference> references) {
        this.references = references == null ? new ArrayList<>() : references;
    }
}

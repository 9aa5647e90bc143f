package com.formulagrid.app.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Represents one table:
 * - an id and a display name
 * - its cells, in the order they were supplied, built once and never replaced
 * - an address -> cell index for constant-time lookup
 * - the resolver used to reach other tables from formulas
 */
public class Table {
    private final String id;
    private final String name;
    private final List<Cell> cells;
    private final Map<CellAddress, Cell> index;
    private final TableResolver resolver;

    public Table(TableDefinition definition) {
        this(definition, null);
    }

    /**
     * Builds every cell of {@code definition}. EMPTY cells are skipped; cell types
     * the upstream source didn't recognise are kept as plain values.
     *
     * @throws IllegalArgumentException if the id is missing or two cells share an address
     * @throws com.formulagrid.app.exceptions.InvalidAddressException if a cell is out of bounds
     */
    public Table(TableDefinition definition, TableResolver resolver) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Table id is required");
        }
        this.id = definition.getId();
        this.name = definition.getName() == null ? definition.getId() : definition.getName();
        this.resolver = resolver;

        List<Cell> built = new ArrayList<>();
        Map<CellAddress, Cell> byAddress = new HashMap<>();
        for (CellDefinition cellDefinition : definition.getCells()) {
            Cell cell = createCell(cellDefinition);
            if (cell == null) {
                continue;
            }
            if (byAddress.putIfAbsent(cell.getAddress(), cell) != null) {
                throw new IllegalArgumentException("Duplicate cell " + cell.getAddress() + " in table " + id);
            }
            built.add(cell);
        }
        this.cells = Collections.unmodifiableList(built);
        this.index = Collections.unmodifiableMap(byAddress);
    }

    private Cell createCell(CellDefinition definition) {
        CellAddress address = CellAddress.of(definition.getRow(), definition.getColumn());
        CellType type = definition.getCellType() == null ? CellType.VALUE : definition.getCellType();
        switch (type) {
            case FORMULA:
                return new FormulaCell(this, address, definition.getId(), definition.getFormula(),
                        definition.getFormatType());
            case LINK:
                return new ReferenceCell(this, address, definition.getId(), definition.getReferences());
            case EMPTY:
                return null;
            case VALUE:
            default:
                return new ValueCell(this, address, definition.getId(), definition.getValue(),
                        definition.getFormatType());
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Cell> getCells() {
        return cells;
    }

    /**
     * Retrieves the cell at {@code address}, or null if this table has none there.
     */
    public Cell getCell(CellAddress address) {
        return index.get(address);
    }

    public Cell getCell(String address) {
        return index.get(CellAddress.parse(address));
    }

    /**
     * Ids of every table the link cells of this table point to. Computed on each call.
     */
    public Set<String> getLinkedTableIds() {
        Set<String> ids = new TreeSet<>();
        for (Cell cell : cells) {
            switch (cell.getKind()) {
                case REFERENCE:
                    ids.addAll(((ReferenceCell) cell).getReferencedTableIds());
                    break;
                case VALUE:
                case FORMULA:
                default:
                    break;
            }
        }
        return ids;
    }

    /**
     * Finds the table an external reference qualifier names: this table for its own id or
     * name, otherwise whatever the resolver knows. Null if nobody does.
     */
    public Table resolveTable(String qualifier) {
        if (id.equals(qualifier) || name.equals(qualifier)) {
            return this;
        }
        return resolver == null ? null : resolver.findTable(qualifier);
    }

    /**
     * Puts every formula cell of this table back to PENDING.
     */
    public void reset() {
        for (Cell cell : cells) {
            if (cell.getKind() == CellKind.FORMULA) {
                ((FormulaCell) cell).reset();
            }
        }
    }
}

package com.formulagrid.app.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A set of tables materialised together, so formulas can reach from one into another.
 * - Has a unique ID
 * - Tables by id (and by name for quoted references)
 * - A read/write lock: an evaluation pass mutates cell state and takes the write lock
 */
public class Workbook implements TableResolver {

    // Generates unique IDs for newly created workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Map<String, Table> tablesById = new LinkedHashMap<>();
    private final Map<String, Table> tablesByName = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @throws IllegalArgumentException if two tables share an id
     */
    public Workbook(List<TableDefinition> definitions) {
        this.id = ID_GENERATOR.getAndIncrement();
        for (TableDefinition definition : definitions) {
            Table table = new Table(definition, this);
            if (tablesById.putIfAbsent(table.getId(), table) != null) {
                throw new IllegalArgumentException("Duplicate table id: " + table.getId());
            }
            tablesByName.putIfAbsent(table.getName(), table);
        }
    }

    public long getId() {
        return id;
    }

    public Collection<Table> getTables() {
        return Collections.unmodifiableCollection(new ArrayList<>(tablesById.values()));
    }

    /**
     * Retrieves a table by id, or null if there is none.
     */
    public Table getTable(String tableId) {
        return tablesById.get(tableId);
    }

    @Override
    public Table findTable(String idOrName) {
        Table table = tablesById.get(idOrName);
        return table != null ? table : tablesByName.get(idOrName);
    }

    /**
     * Puts every formula cell of every table back to PENDING.
     */
    public void reset() {
        for (Table table : tablesById.values()) {
            table.reset();
        }
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}

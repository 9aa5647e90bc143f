package com.formulagrid.app.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable-by-convention construction input for a {@link Table}:
 * { "id", "name", "description", "cells": [...] }.
 */
public class TableDefinition {
    private String id;
    private String name;
    private String description;
    private List<CellDefinition> cells = new ArrayList<>();

    // Default constructor needed for JSON (de)serialization
    public TableDefinition() {
    }

    public TableDefinition(String id, String name, List<CellDefinition> cells) {
        this.id = id;
        this.name = name;
        setCells(cells);
    }

    public static TableDefinition of(String id, CellDefinition... cells) {
        return new TableDefinition(id, id, new ArrayList<>(Arrays.asList(cells)));
    }

    public String getId() {
        return id;
    }
    public String getName() {
        return name;
    }
    public String getDescription() {
        return description;
    }
    public List<CellDefinition> getCells() {
        return cells;
    }

    public void setId(String id) {
        this.id = id;
    }
    public void setName(String name) {
        this.name = name;
    }
    public void setDescription(String description) {
        this.description = description;
    }
    public void setCells(List<CellDefinition> cells) {
        this.cells = cells == null ? new ArrayList<>() : cells;
    }
}

package com.formulagrid.app.controllers;

import com.formulagrid.app.models.TableDefinition;
import com.formulagrid.app.services.CellView;
import com.formulagrid.app.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for evaluating workbooks of linked tables.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook
     * Expects a JSON body containing a "tables" array, each table shaped like
     * { "id", "name", "cells": [ { "row", "column", "cell_type", "value" | "formula" | "references" } ] }.
     * Materialises the tables and returns the workbookId.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook(@RequestBody Map<String, List<TableDefinition>> request) {
        List<TableDefinition> tables = request.get("tables");
        long workbookId = workbookService.createWorkbook(tables);
        return ResponseEntity.ok(workbookId);
    }

    /**
     * GET /workbook/{workbookId}
     * Evaluates every cell and returns, per table id, the rendered cells:
     * { "t1": [ { "address": "A1", "kind": "VALUE", "value": 10 }, ... ], ... }.
     * Cells that fail carry "error" and "errorKind" instead of a value.
     */
    @GetMapping("/{workbookId}")
    public ResponseEntity<Map<String, List<CellView>>> getWorkbook(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.evaluateWorkbook(workbookId));
    }

    /**
     * POST /workbook/{workbookId}/recalculate
     * Like GET /workbook/{workbookId}, but recomputes every formula instead of using cached values.
     */
    @PostMapping("/{workbookId}/recalculate")
    public ResponseEntity<Map<String, List<CellView>>> recalculate(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.recalculate(workbookId));
    }

    /**
     * GET /workbook/{workbookId}/table/{tableId}/cell/{address}
     * Evaluates one cell, e.g. /workbook/1/table/t1/cell/B4.
     */
    @GetMapping("/{workbookId}/table/{tableId}/cell/{address}")
    public ResponseEntity<CellView> getCell(
            @PathVariable long workbookId,
            @PathVariable String tableId,
            @PathVariable String address
    ) {
        return ResponseEntity.ok(workbookService.evaluateCell(workbookId, tableId, address));
    }

    /**
     * GET /workbook/{workbookId}/table/{tableId}/dependencies
     * Returns, for each formula cell, the addresses it depends on:
     * { "B4": ["B2", "B3"] }.
     */
    @GetMapping("/{workbookId}/table/{tableId}/dependencies")
    public ResponseEntity<Map<String, Set<String>>> getDependencies(
            @PathVariable long workbookId,
            @PathVariable String tableId
    ) {
        return ResponseEntity.ok(workbookService.getDependencies(workbookId, tableId));
    }

    /**
     * GET /workbook/{workbookId}/table/{tableId}/links
     * Returns the ids of the tables this table's link cells point to.
     */
    @GetMapping("/{workbookId}/table/{tableId}/links")
    public ResponseEntity<Set<String>> getLinkedTables(
            @PathVariable long workbookId,
            @PathVariable String tableId
    ) {
        return ResponseEntity.ok(workbookService.getLinkedTableIds(workbookId, tableId));
    }
}

package com.formulagrid.app.services;

import com.formulagrid.app.exceptions.CellEvaluationException;
import com.formulagrid.app.exceptions.CellNotFoundException;
import com.formulagrid.app.exceptions.TableNotFoundException;
import com.formulagrid.app.exceptions.WorkbookNotFoundException;
import com.formulagrid.app.models.Cell;
import com.formulagrid.app.models.CellAddress;
import com.formulagrid.app.models.FormulaCell;
import com.formulagrid.app.models.ReferenceCell;
import com.formulagrid.app.models.Table;
import com.formulagrid.app.models.TableDefinition;
import com.formulagrid.app.models.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Main business logic: materialising workbooks from upstream table definitions,
 * evaluating their cells, and rendering the results for downstream consumers.
 */
@Service
public class WorkbookService {

    private static final Logger log = LoggerFactory.getLogger(WorkbookService.class);

    // All workbooks live here in memory; evaluation state is never persisted
    private final Map<Long, Workbook> workbooks = new ConcurrentHashMap<>();

    private final EvaluationProperties properties;

    public WorkbookService(EvaluationProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds every table up front and returns the new workbook's ID.
     * Nothing is evaluated yet.
     */
    public long createWorkbook(List<TableDefinition> tables) {
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("A workbook needs at least one table");
        }
        Workbook workbook = new Workbook(tables);
        workbooks.put(workbook.getId(), workbook);
        log.info("Created workbook {} with {} table(s)", workbook.getId(), tables.size());
        return workbook.getId();
    }

    /**
     * Retrieves a Workbook by ID. Throws if not found.
     */
    public Workbook getWorkbook(long workbookId) {
        Workbook workbook = workbooks.get(workbookId);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return workbook;
    }

    public Table getTable(long workbookId, String tableId) {
        Table table = getWorkbook(workbookId).getTable(tableId);
        if (table == null) {
            throw new TableNotFoundException("Table " + tableId + " not found in workbook " + workbookId);
        }
        return table;
    }

    /**
     * Evaluates every cell of every table and returns tableId -> rendered cells.
     * Cells computed by earlier calls are served from their cache.
     */
    public Map<String, List<CellView>> evaluateWorkbook(long workbookId) {
        return render(getWorkbook(workbookId), false);
    }

    /**
     * Same as {@link #evaluateWorkbook(long)}, but every formula is computed again.
     */
    public Map<String, List<CellView>> recalculate(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        log.info("Recalculating workbook {}", workbookId);
        return render(workbook, true);
    }

    /**
     * Evaluates and renders a single cell.
     */
    public CellView evaluateCell(long workbookId, String tableId, String address) {
        Workbook workbook = getWorkbook(workbookId);
        Table table = getTable(workbookId, tableId);
        Cell cell = table.getCell(CellAddress.parse(address));
        if (cell == null) {
            throw new CellNotFoundException(tableId, address);
        }
        workbook.getLock().writeLock().lock();
        try {
            return renderCell(cell, properties.newContext(false));
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Formula address -> the local addresses it depends on, from static analysis only.
     */
    public Map<String, Set<String>> getDependencies(long workbookId, String tableId) {
        Table table = getTable(workbookId, tableId);
        Map<String, Set<String>> graph = new TreeMap<>();
        for (Cell cell : table.getCells()) {
            switch (cell.getKind()) {
                case FORMULA:
                    Set<String> targets = ((FormulaCell) cell).getDependencies().getDirectReferences().stream()
                            .map(CellAddress::format)
                            .collect(Collectors.toCollection(TreeSet::new));
                    graph.put(cell.getAddress().format(), targets);
                    break;
                case VALUE:
                case REFERENCE:
                default:
                    break;
            }
        }
        return graph;
    }

    public Set<String> getLinkedTableIds(long workbookId, String tableId) {
        return getTable(workbookId, tableId).getLinkedTableIds();
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private Map<String, List<CellView>> render(Workbook workbook, boolean forceRecompute) {
        workbook.getLock().writeLock().lock();
        try {
            // One context for the whole pass, so loops across tables are caught
            EvaluationContext context = properties.newContext(forceRecompute);
            Map<String, List<CellView>> result = new LinkedHashMap<>();
            for (Table table : workbook.getTables()) {
                List<CellView> views = new ArrayList<>();
                for (Cell cell : table.getCells()) {
                    views.add(renderCell(cell, context));
                }
                result.put(table.getId(), views);
            }
            log.debug("Workbook {}: computed {} formula cell(s)", workbook.getId(), context.getComputed().size());
            return result;
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    private CellView renderCell(Cell cell, EvaluationContext context) {
        String address = cell.getAddress().format();
        switch (cell.getKind()) {
            case FORMULA:
                FormulaCell formulaCell = (FormulaCell) cell;
                try {
                    Object value = formulaCell.evaluate(context);
                    return new CellView(address, cell.getKind(), value, formulaCell.getFormula(), null, null, null);
                } catch (CellEvaluationException e) {
                    log.debug("Evaluation of {} failed ({}): {}", cell.getKey(), e.getKind(), e.getMessage());
                    return new CellView(address, cell.getKind(), null, formulaCell.getFormula(), null,
                            e.getMessage(), e.getKind());
                }
            case REFERENCE:
                ReferenceCell referenceCell = (ReferenceCell) cell;
                return new CellView(address, cell.getKind(), referenceCell.evaluate(context), null,
                        referenceCell.getTarget(), null, null);
            case VALUE:
            default:
                return new CellView(address, cell.getKind(), cell.evaluate(context), null, null, null, null);
        }
    }
}

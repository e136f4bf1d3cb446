package com.spreadsheet.engine.services;

import com.spreadsheet.engine.dependency.DependencyGraph;
import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.formula.Expr;
import com.spreadsheet.engine.formula.FormulaParser;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.references.ReferenceAdjuster;
import com.spreadsheet.engine.references.ReferenceTracker;
import com.spreadsheet.engine.references.StructuralOperation;
import com.spreadsheet.engine.repository.CellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Applies row/column insertion and deletion and range moves to a sheet's storage:
 * cells are relocated, every formula is rewritten for the edit, and the
 * dependency indexes are rebuilt from scratch. Recalculation is left to the caller.
 */
public class StructuralOperationsService {

    private static final Logger logger = LoggerFactory.getLogger(StructuralOperationsService.class);

    private final CellRepository repository;
    private final DependencyGraph graph;
    private final ReferenceTracker tracker;
    private final ReferenceAdjuster adjuster;
    private final FormulaParser parser;

    public StructuralOperationsService(CellRepository repository, DependencyGraph graph,
                                       ReferenceTracker tracker, ReferenceAdjuster adjuster,
                                       FormulaParser parser) {
        this.repository = repository;
        this.graph = graph;
        this.tracker = tracker;
        this.adjuster = adjuster;
        this.parser = parser;
    }

    /**
     * @return the new addresses of the cells that survived, row-major; empty for a no-op
     */
    public List<CellAddress> apply(StructuralOperation operation) {
        if (operation.isNoOp()) {
            return Collections.emptyList();
        }
        Map<CellAddress, Cell> relocated = new TreeMap<>();
        int dropped = 0;
        for (Map.Entry<CellAddress, Cell> entry : repository.entries().entrySet()) {
            CellAddress target = operation.apply(entry.getKey());
            if (target == null) {
                dropped++;
                continue;
            }
            relocated.put(target, rewrite(entry.getValue(), operation));
        }

        repository.clear();
        for (Map.Entry<CellAddress, Cell> entry : relocated.entrySet()) {
            repository.put(entry.getKey(), entry.getValue());
        }
        rebuildDependencies();

        logger.info("Applied {}: {} cells kept, {} removed", operation, relocated.size(), dropped);
        return new ArrayList<>(relocated.keySet());
    }

    /**
     * Clears the graph and tracker and re-registers every formula in the repository.
     */
    public void rebuildDependencies() {
        graph.clear();
        tracker.clear();
        for (Map.Entry<CellAddress, Cell> entry : repository.entries().entrySet()) {
            register(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Replaces the recorded references of one cell with those of its current content.
     */
    public void register(CellAddress address, Cell cell) {
        tracker.removeDependencies(address);
        graph.removeDependenciesFor(address);
        graph.addCell(address);
        if (cell != null && cell.hasFormula()) {
            for (CellAddress reference : tracker.updateDependencies(address, cell.getFormula())) {
                graph.addDependency(address, reference);
            }
        }
    }

    /**
     * Forgets a removed cell's references; the node stays while other cells still point at it.
     */
    public void unregister(CellAddress address) {
        tracker.removeDependencies(address);
        graph.detachCell(address);
    }

    private Cell rewrite(Cell cell, StructuralOperation operation) {
        if (!cell.hasFormula()) {
            return cell;
        }
        String text = adjuster.adjustFormula(cell.getRawText(), operation);
        if (text.equals(cell.getRawText())) {
            return cell;
        }
        try {
            Expr expr = parser.parse(text);
            return new Cell(text, expr, cell.getComputedValue());
        } catch (FormulaParseException e) {
            logger.warn("Formula {} no longer parses after {}: {}", text, operation, e.getMessage());
            return Cell.literal(text, CellValue.error(e.getErrorType(), e.getMessage()));
        }
    }
}

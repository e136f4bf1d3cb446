package com.spreadsheet.engine.services;

import com.spreadsheet.engine.batch.BatchManager;
import com.spreadsheet.engine.batch.BatchOperation;
import com.spreadsheet.engine.batch.BatchService;
import com.spreadsheet.engine.commands.BatchCommand;
import com.spreadsheet.engine.commands.Command;
import com.spreadsheet.engine.commands.CommandExecutor;
import com.spreadsheet.engine.commands.DeleteCellCommand;
import com.spreadsheet.engine.commands.DeleteColumnsCommand;
import com.spreadsheet.engine.commands.DeleteRowsCommand;
import com.spreadsheet.engine.commands.InsertColumnsCommand;
import com.spreadsheet.engine.commands.InsertRowsCommand;
import com.spreadsheet.engine.commands.MoveRangeCommand;
import com.spreadsheet.engine.commands.SetCellCommand;
import com.spreadsheet.engine.commands.StructuralCommand;
import com.spreadsheet.engine.commands.UndoRedoManager;
import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.dependency.DependencyGraph;
import com.spreadsheet.engine.evaluator.EvaluationContext;
import com.spreadsheet.engine.evaluator.Evaluator;
import com.spreadsheet.engine.evaluator.FunctionLibrary;
import com.spreadsheet.engine.evaluator.Operators;
import com.spreadsheet.engine.events.EventDispatcher;
import com.spreadsheet.engine.events.SpreadsheetEvent;
import com.spreadsheet.engine.events.SpreadsheetEventListener;
import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.exceptions.SpreadsheetException;
import com.spreadsheet.engine.fill.FillEngine;
import com.spreadsheet.engine.fill.FillOperation;
import com.spreadsheet.engine.fill.FillResult;
import com.spreadsheet.engine.fill.FormulaAdjuster;
import com.spreadsheet.engine.formula.FormulaParser;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.references.ReferenceAdjuster;
import com.spreadsheet.engine.references.ReferenceTracker;
import com.spreadsheet.engine.references.StructuralOperation;
import com.spreadsheet.engine.repository.CellRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One spreadsheet session: cell storage, formulas, dependency tracking, recalculation,
 * structural edits, fill, batches and undo/redo.
 *
 * Every mutation exists twice: the public recorded form ({@link #setCell}, {@link #insertRows}, ...)
 * goes through the undo manager, while the "Direct" forms required by {@link CommandExecutor}
 * change the sheet without recording anything.
 *
 * Not thread-safe; callers serialize access (see {@code Sheet}).
 */
public class SpreadsheetEngine implements CommandExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetEngine.class);

    private final EngineProperties properties;
    private final CellRepository repository = new CellRepository();
    private final DependencyGraph graph = new DependencyGraph();
    private final ReferenceTracker tracker = new ReferenceTracker();
    private final FormulaParser parser = new FormulaParser();
    private final Evaluator evaluator;
    private final StructuralOperationsService structural;
    private final FillEngine fillEngine;
    private final UndoRedoManager undoManager;
    private final EventDispatcher events = new EventDispatcher();
    private final BatchService batchService;
    private final CommandExecutor deferred = new DeferredExecutor();

    public SpreadsheetEngine() {
        this(new EngineProperties());
    }

    public SpreadsheetEngine(EngineProperties properties) {
        this(properties, new FunctionLibrary());
    }

    public SpreadsheetEngine(EngineProperties properties, FunctionLibrary functions) {
        this.properties = properties;
        this.evaluator = new Evaluator(functions);
        ReferenceAdjuster adjuster = new ReferenceAdjuster();
        this.structural = new StructuralOperationsService(repository, graph, tracker, adjuster, parser);
        this.fillEngine = new FillEngine(repository, new FormulaAdjuster(adjuster));
        this.undoManager = new UndoRedoManager(properties.getMaxUndo(), properties.getMaxRedo());
        this.batchService = new BatchService(new BatchManager(), events);
    }

    // ----------------------------------------------------------------
    // Cells
    // ----------------------------------------------------------------

    /**
     * Writes a cell from text as typed. Text starting with '=' is a formula; anything else
     * is stored as a number, a boolean or a string, in that order of preference.
     *
     * @return the new cell, with its computed value
     * @throws FormulaParseException if the formula does not parse; the cell is left unchanged
     */
    public Cell setCell(CellAddress address, String text) {
        undoManager.execute(new SetCellCommand(address, text), this);
        return repository.get(address).orElseThrow(IllegalStateException::new);
    }

    public Cell setCell(String address, String text) {
        return setCell(CellAddress.fromA1(address), text);
    }

    /**
     * @return true if there was a cell to delete
     */
    public boolean deleteCell(CellAddress address) {
        if (!repository.contains(address)) {
            return false;
        }
        undoManager.execute(new DeleteCellCommand(address), this);
        return true;
    }

    @Override
    public Optional<Cell> getCell(CellAddress address) {
        return repository.get(address);
    }

    public Optional<Cell> getCell(String address) {
        return getCell(CellAddress.fromA1(address));
    }

    /**
     * Computed value of a cell; Empty when the cell is unset.
     */
    public CellValue getValue(CellAddress address) {
        return repository.get(address).map(Cell::getComputedValue).orElse(CellValue.EMPTY);
    }

    public CellValue getValue(String address) {
        return getValue(CellAddress.fromA1(address));
    }

    public List<CellAddress> getCellAddresses() {
        return repository.addresses();
    }

    public int getCellCount() {
        return repository.size();
    }

    public Map<CellAddress, Set<CellAddress>> getForwardDependencies() {
        return graph.getForwardGraph();
    }

    public Map<CellAddress, Set<CellAddress>> getReverseDependencies() {
        return graph.getReverseGraph();
    }

    // ----------------------------------------------------------------
    // Structure
    // ----------------------------------------------------------------

    public List<CellAddress> insertRows(int beforeRow, int count) {
        return runStructural(new InsertRowsCommand(beforeRow, count),
                StructuralOperation.insertRows(beforeRow, count));
    }

    public List<CellAddress> deleteRows(int startRow, int count) {
        return runStructural(new DeleteRowsCommand(startRow, count),
                StructuralOperation.deleteRows(startRow, count));
    }

    public List<CellAddress> insertColumns(int beforeCol, int count) {
        return runStructural(new InsertColumnsCommand(beforeCol, count),
                StructuralOperation.insertColumns(beforeCol, count));
    }

    public List<CellAddress> deleteColumns(int startCol, int count) {
        return runStructural(new DeleteColumnsCommand(startCol, count),
                StructuralOperation.deleteColumns(startCol, count));
    }

    /**
     * Moves the cells of a range so its top-left corner lands on the given address.
     * Formulas anywhere on the sheet follow the moved cells.
     */
    public List<CellAddress> moveRange(CellRange from, CellAddress toTopLeft) {
        return runStructural(new MoveRangeCommand(from, toTopLeft), StructuralOperation.moveRange(from, toTopLeft));
    }

    // the operation is built first so bad arguments fail before anything is recorded
    private List<CellAddress> runStructural(StructuralCommand command, StructuralOperation operation) {
        if (operation.isNoOp()) {
            return Collections.emptyList();
        }
        undoManager.execute(command, this);
        return command.getAffected();
    }

    // ----------------------------------------------------------------
    // Batches
    // ----------------------------------------------------------------

    public String beginBatch() {
        return beginBatch(null);
    }

    public String beginBatch(String batchId) {
        return batchService.beginBatch(batchId);
    }

    public void addToBatch(String batchId, BatchOperation operation) {
        batchService.addOperation(batchId, operation);
    }

    /**
     * Applies the buffered operations, recalculates once and records the batch as one undo step.
     *
     * @return the addresses written or deleted, row-major
     */
    public List<CellAddress> commitBatch(String batchId) {
        List<CellAddress> committed = new ArrayList<>();
        BatchCommand command = batchService.commitBatch(batchId, deferred, affected -> {
            committed.addAll(affected);
            recalculateFrom(affected, null);
        });
        if (command.size() > 0) {
            undoManager.record(command);
        }
        return committed;
    }

    public void rollbackBatch(String batchId) {
        batchService.rollbackBatch(batchId);
    }

    public Set<String> getActiveBatches() {
        return batchService.activeBatchIds();
    }

    // ----------------------------------------------------------------
    // Fill
    // ----------------------------------------------------------------

    /**
     * Fills the target range and records the fill as one undo step.
     */
    public FillResult fill(FillOperation operation) {
        FillResult result = fillEngine.fill(operation);
        List<Command> commands = new ArrayList<>();
        for (Map.Entry<CellAddress, CellValue> entry : result.getAffectedCells().entrySet()) {
            CellValue value = entry.getValue();
            if (value.isEmpty()) {
                commands.add(new DeleteCellCommand(entry.getKey()));
            } else {
                commands.add(new SetCellCommand(entry.getKey(), literalText(value)));
            }
        }
        for (Map.Entry<CellAddress, String> entry : result.getFormulasAdjusted().entrySet()) {
            commands.add(new SetCellCommand(entry.getKey(), entry.getValue()));
        }

        Set<CellAddress> written = new LinkedHashSet<>(result.getAffectedCells().keySet());
        written.addAll(result.getFormulasAdjusted().keySet());
        BatchCommand command = new BatchCommand(commands,
                "Fill " + operation.getTargetRange().toA1() + " from " + operation.getSourceRange().toA1());
        command.execute(deferred);
        recalculateFrom(written, null);
        undoManager.record(command);
        logger.info("Filled {} {} from {} ({} cells)", operation.getTargetRange().toA1(),
                operation.getDirection(), operation.getSourceRange().toA1(), written.size());
        return result;
    }

    /**
     * What {@link #fill} would write, without changing anything.
     */
    public FillResult preview(FillOperation operation) {
        return fillEngine.fill(operation);
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    public Optional<String> undo() {
        return undoManager.undo(this);
    }

    public Optional<String> redo() {
        return undoManager.redo(this);
    }

    public boolean canUndo() {
        return undoManager.canUndo();
    }

    public boolean canRedo() {
        return undoManager.canRedo();
    }

    public List<String> getUndoHistory() {
        return undoManager.getUndoHistory();
    }

    public List<String> getRedoHistory() {
        return undoManager.getRedoHistory();
    }

    public UndoRedoManager getUndoManager() {
        return undoManager;
    }

    // ----------------------------------------------------------------
    // Recalculation and listeners
    // ----------------------------------------------------------------

    /**
     * Re-evaluates every formula on the sheet.
     *
     * @return the recalculated cells in evaluation order
     */
    public List<CellAddress> recalculate() {
        return recalculateFrom(formulaCells(), null);
    }

    public void addListener(SpreadsheetEventListener listener) {
        events.addListener(listener);
    }

    public void removeListener(SpreadsheetEventListener listener) {
        events.removeListener(listener);
    }

    public EngineProperties getProperties() {
        return properties;
    }

    // ----------------------------------------------------------------
    // CommandExecutor
    // ----------------------------------------------------------------

    @Override
    public Cell setCellDirect(CellAddress address, String text) {
        return writeCell(address, text, true);
    }

    @Override
    public Cell deleteCellDirect(CellAddress address) {
        return removeCell(address, true);
    }

    @Override
    public List<CellAddress> insertRowsDirect(int beforeRow, int count) {
        return applyStructural(StructuralOperation.insertRows(beforeRow, count));
    }

    @Override
    public List<CellAddress> deleteRowsDirect(int startRow, int count) {
        return applyStructural(StructuralOperation.deleteRows(startRow, count));
    }

    @Override
    public List<CellAddress> insertColumnsDirect(int beforeCol, int count) {
        return applyStructural(StructuralOperation.insertColumns(beforeCol, count));
    }

    @Override
    public List<CellAddress> deleteColumnsDirect(int startCol, int count) {
        return applyStructural(StructuralOperation.deleteColumns(startCol, count));
    }

    @Override
    public List<CellAddress> moveRangeDirect(CellRange from, CellAddress toTopLeft) {
        return applyStructural(StructuralOperation.moveRange(from, toTopLeft));
    }

    @Override
    public Map<CellAddress, String> snapshotCells() {
        Map<CellAddress, String> snapshot = new TreeMap<>();
        for (Map.Entry<CellAddress, Cell> entry : repository.entries().entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().getRawText());
        }
        return snapshot;
    }

    @Override
    public void restoreCells(Map<CellAddress, String> snapshot) {
        repository.clear();
        for (Map.Entry<CellAddress, String> entry : snapshot.entrySet()) {
            repository.put(entry.getKey(), restoredCell(entry.getValue()));
        }
        structural.rebuildDependencies();
        recalculate();
        events.dispatch(SpreadsheetEvent.structureChanged(repository.addresses()));
    }

    // ----------------------------------------------------------------
    // Internals
    // ----------------------------------------------------------------

    private Cell writeCell(CellAddress address, String text, boolean recalc) {
        Cell cell = buildCell(text);
        Cell previous = repository.put(address, cell);
        structural.register(address, cell);
        if (recalc) {
            try {
                recalculateFrom(Collections.singleton(address), address);
            } catch (SpreadsheetException e) {
                logger.debug("Reverting {} after failed evaluation: {}", address, e.getMessage());
                if (previous == null) {
                    repository.remove(address);
                    structural.unregister(address);
                } else {
                    repository.put(address, previous);
                    structural.register(address, previous);
                }
                recalculateFrom(Collections.singleton(address), null);
                throw e;
            }
        }
        events.dispatch(SpreadsheetEvent.cellUpdated(address));
        return previous;
    }

    private Cell removeCell(CellAddress address, boolean recalc) {
        Cell previous = repository.remove(address);
        if (previous == null) {
            return null;
        }
        structural.unregister(address);
        if (recalc) {
            recalculateFrom(Collections.singleton(address), null);
        }
        events.dispatch(SpreadsheetEvent.cellDeleted(address));
        return previous;
    }

    private List<CellAddress> applyStructural(StructuralOperation operation) {
        List<CellAddress> affected = structural.apply(operation);
        if (!operation.isNoOp()) {
            recalculate();
            events.dispatch(SpreadsheetEvent.structureChanged(affected));
        }
        return affected;
    }

    private Cell buildCell(String text) {
        String raw = text == null ? "" : text;
        if (raw.startsWith("=")) {
            return Cell.formula(raw, parser.parse(raw));
        }
        return Cell.literal(raw, parseLiteral(raw));
    }

    // Snapshots may hold formulas that were already broken when they were taken
    private Cell restoredCell(String raw) {
        try {
            return buildCell(raw);
        } catch (FormulaParseException e) {
            return Cell.literal(raw, CellValue.error(e.getErrorType(), e.getMessage()));
        }
    }

    static CellValue parseLiteral(String raw) {
        if (raw.isEmpty()) {
            return CellValue.EMPTY;
        }
        Double number = Operators.parseNumber(raw);
        if (number != null) {
            return CellValue.number(number);
        }
        if ("TRUE".equalsIgnoreCase(raw)) {
            return CellValue.TRUE;
        }
        if ("FALSE".equalsIgnoreCase(raw)) {
            return CellValue.FALSE;
        }
        return CellValue.string(raw);
    }

    static String literalText(CellValue value) {
        switch (value.getKind()) {
            case NUMBER:
                return CellValue.formatNumber(value.getNumber());
            case BOOLEAN:
                return value.getBoolean() ? "TRUE" : "FALSE";
            case STRING:
                return value.getString();
            default:
                return value.toDisplayString();
        }
    }

    private List<CellAddress> formulaCells() {
        List<CellAddress> result = new ArrayList<>();
        for (Map.Entry<CellAddress, Cell> entry : repository.entries().entrySet()) {
            if (entry.getValue().hasFormula()) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /**
     * Recalculates the changed cells and everything depending on them.
     *
     * @param strict a cell whose hard evaluation failure is rethrown instead of stored, or null
     */
    private List<CellAddress> recalculateFrom(Collection<CellAddress> changed, CellAddress strict) {
        List<CellAddress> order = tracker.getAffectedCells(changed);
        new Recalculation(order, strict).run();
        logger.debug("Recalculated {} cells from {}", order.size(), changed);
        events.dispatch(SpreadsheetEvent.calculationCompleted(order));
        return order;
    }

    /**
     * One recalculation pass. Formula cells still pending are evaluated on demand when another
     * formula reads them, so a reference that loops back finds its target on the evaluation
     * stack and every cell of the loop ends up #CIRC!.
     */
    private final class Recalculation implements EvaluationContext {

        private final Set<CellAddress> pending = new LinkedHashSet<>();
        private final Set<CellAddress> evaluating = new LinkedHashSet<>();
        private final CellAddress strict;
        private SpreadsheetException failure;

        Recalculation(List<CellAddress> order, CellAddress strict) {
            for (CellAddress address : order) {
                Optional<Cell> cell = repository.get(address);
                if (cell.isPresent() && cell.get().hasFormula()) {
                    pending.add(address);
                }
            }
            this.strict = strict;
        }

        void run() {
            while (!pending.isEmpty()) {
                evaluateCell(pending.iterator().next());
            }
        }

        private void evaluateCell(CellAddress address) {
            pending.remove(address);
            Cell cell = repository.get(address).orElseThrow(IllegalStateException::new);
            CellValue value;
            pushEvaluation(address);
            try {
                value = evaluator.evaluate(cell.getFormula(), this);
            } catch (SpreadsheetException e) {
                if (address.equals(strict) || failure != null) {
                    failure = e;
                    throw e;
                }
                logger.warn("Evaluation of {} ({}) failed, storing error: {}",
                        address, cell.getRawText(), e.getMessage());
                value = CellValue.error(e.getErrorType(), e.getMessage());
            } finally {
                popEvaluation(address);
            }
            cell.setComputedValue(value);
        }

        @Override
        public CellValue getCellValue(CellAddress address) {
            if (pending.contains(address)) {
                evaluateCell(address);
            }
            return getValue(address);
        }

        @Override
        public boolean isEvaluating(CellAddress address) {
            return evaluating.contains(address);
        }

        @Override
        public void pushEvaluation(CellAddress address) {
            evaluating.add(address);
        }

        @Override
        public void popEvaluation(CellAddress address) {
            evaluating.remove(address);
        }

        @Override
        public boolean isLocalSheet(String name) {
            return name.equalsIgnoreCase(properties.getSheetName());
        }
    }

    /**
     * Writes without per-cell recalculation, for batches and fills that recalculate once at the end.
     */
    private final class DeferredExecutor implements CommandExecutor {

        @Override
        public Cell setCellDirect(CellAddress address, String text) {
            return writeCell(address, text, false);
        }

        @Override
        public Cell deleteCellDirect(CellAddress address) {
            return removeCell(address, false);
        }

        @Override
        public List<CellAddress> insertRowsDirect(int beforeRow, int count) {
            return SpreadsheetEngine.this.insertRowsDirect(beforeRow, count);
        }

        @Override
        public List<CellAddress> deleteRowsDirect(int startRow, int count) {
            return SpreadsheetEngine.this.deleteRowsDirect(startRow, count);
        }

        @Override
        public List<CellAddress> insertColumnsDirect(int beforeCol, int count) {
            return SpreadsheetEngine.this.insertColumnsDirect(beforeCol, count);
        }

        @Override
        public List<CellAddress> deleteColumnsDirect(int startCol, int count) {
            return SpreadsheetEngine.this.deleteColumnsDirect(startCol, count);
        }

        @Override
        public List<CellAddress> moveRangeDirect(CellRange from, CellAddress toTopLeft) {
            return SpreadsheetEngine.this.moveRangeDirect(from, toTopLeft);
        }

        @Override
        public Map<CellAddress, String> snapshotCells() {
            return SpreadsheetEngine.this.snapshotCells();
        }

        @Override
        public void restoreCells(Map<CellAddress, String> snapshot) {
            SpreadsheetEngine.this.restoreCells(snapshot);
        }

        @Override
        public Optional<Cell> getCell(CellAddress address) {
            return SpreadsheetEngine.this.getCell(address);
        }
    }
}

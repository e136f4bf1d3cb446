package com.spreadsheet.engine.services;

import com.spreadsheet.engine.batch.BatchOperation;
import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.events.EventType;
import com.spreadsheet.engine.events.SpreadsheetEvent;
import com.spreadsheet.engine.evaluator.FunctionLibrary;
import com.spreadsheet.engine.exceptions.BatchNotFoundException;
import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.exceptions.InvalidFormulaException;
import com.spreadsheet.engine.exceptions.InvalidReferenceException;
import com.spreadsheet.engine.fill.FillDirection;
import com.spreadsheet.engine.fill.FillOperation;
import com.spreadsheet.engine.fill.FillResult;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class SpreadsheetEngineTest {

    private SpreadsheetEngine engine;
    private List<SpreadsheetEvent> events;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
        events = new ArrayList<>();
        engine.addListener(events::add);
    }

    private static CellAddress at(String a1) {
        return CellAddress.fromA1(a1);
    }

    private String raw(String address) {
        return engine.getCell(address).map(cell -> cell.getRawText()).orElse(null);
    }

    private long count(EventType type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }

    @Test
    void testLiteralTypes() {
        assertEquals(CellValue.number(42), engine.setCell("A1", "42").getComputedValue());
        assertEquals(CellValue.number(350), engine.setCell("A2", "3.5e2").getComputedValue());
        assertEquals(CellValue.TRUE, engine.setCell("A3", "true").getComputedValue());
        assertEquals(CellValue.string("hello"), engine.setCell("A4", "hello").getComputedValue());
        assertEquals(CellValue.string("1.2.3"), engine.setCell("A5", "1.2.3").getComputedValue());
        assertEquals(CellValue.EMPTY, engine.setCell("A6", "").getComputedValue());
        assertEquals(6, engine.getCellCount());
    }

    /**
     * Digits outside 0-9 (here Arabic-Indic) are plain text, never numbers.
     */
    @Test
    void testNonAsciiDigitsAreText() {
        assertEquals(CellValue.string("\u0661\u0662"), engine.setCell("A1", "\u0661\u0662").getComputedValue());
        assertEquals(CellValue.string("-\u0663.5"), engine.setCell("A2", "-\u0663.5").getComputedValue());

        engine.setCell("B1", "=A1+1");
        assertEquals(ErrorType.VALUE_ERROR, engine.getValue("B1").getErrorType());

        assertThrows(FormulaParseException.class, () -> engine.setCell("C1", "=\u0661+1"));
        assertFalse(engine.getCell("C1").isPresent());
    }

    @Test
    void testLiteralHelpers() {
        assertEquals(CellValue.number(-0.5), SpreadsheetEngine.parseLiteral("-.5"));
        assertEquals(CellValue.string("NaN"), SpreadsheetEngine.parseLiteral("NaN"));
        assertEquals("4", SpreadsheetEngine.literalText(CellValue.number(4)));
        assertEquals("2.5", SpreadsheetEngine.literalText(CellValue.number(2.5)));
        assertEquals("FALSE", SpreadsheetEngine.literalText(CellValue.FALSE));
    }

    /**
     * Changing an input recalculates the whole chain that reads it.
     */
    @Test
    void testDependentsRecalculate() {
        engine.setCell("A1", "1");
        engine.setCell("B1", "=A1*2");
        engine.setCell("C1", "=B1+A1");
        assertEquals(CellValue.number(3), engine.getValue("C1"));

        engine.setCell("A1", "5");

        assertEquals(CellValue.number(10), engine.getValue("B1"));
        assertEquals(CellValue.number(15), engine.getValue("C1"));
    }

    @Test
    void testFunctionsOverRanges() {
        engine.setCell("A1", "1");
        engine.setCell("A2", "2");
        engine.setCell("A3", "3");
        engine.setCell("B1", "=SUM(A1:A3)");
        engine.setCell("B2", "=IF(B1>5,\"big\",\"small\")");

        assertEquals(CellValue.number(6), engine.getValue("B1"));
        assertEquals(CellValue.string("big"), engine.getValue("B2"));

        engine.setCell("A2", "-10");
        assertEquals(CellValue.string("small"), engine.getValue("B2"));
    }

    @Test
    void testErrorsPropagate() {
        engine.setCell("A1", "=1/0");
        engine.setCell("A2", "=A1+1");

        assertEquals(ErrorType.DIVIDE_BY_ZERO, engine.getValue("A1").getErrorType());
        assertEquals(ErrorType.DIVIDE_BY_ZERO, engine.getValue("A2").getErrorType());
        assertEquals("#DIV/0!", engine.getValue("A2").toDisplayString());

        engine.setCell("A1", "4");
        assertEquals(CellValue.number(5), engine.getValue("A2"));
    }

    /**
     * A formula that does not parse is rejected and the cell keeps its old content.
     */
    @Test
    void testParseErrorLeavesCellUnchanged() {
        engine.setCell("A1", "5");

        assertThrows(FormulaParseException.class, () -> engine.setCell("A1", "=1+"));
        assertThrows(InvalidReferenceException.class, () -> engine.setCell("A1", "=XFE1"));

        assertEquals(CellValue.number(5), engine.getValue("A1"));
        assertEquals(1, engine.getUndoHistory().size());
    }

    @Test
    void testBareRangeIsRevertedAndRethrown() {
        engine.setCell("A1", "7");
        engine.setCell("B1", "=A1+1");

        assertThrows(InvalidFormulaException.class, () -> engine.setCell("A1", "=C1:C2+1"));

        assertEquals("7", raw("A1"));
        assertEquals(CellValue.number(8), engine.getValue("B1"));
        assertThrows(InvalidFormulaException.class, () -> engine.setCell("D1", "=C1:C2"));
        assertFalse(engine.getCell("D1").isPresent());
    }

    @Test
    void testCyclesBecomeCircularErrors() {
        engine.setCell("A1", "=B1");
        engine.setCell("C1", "=A1+1");
        engine.setCell("B1", "=A1");

        assertEquals(ErrorType.CIRCULAR_DEPENDENCY, engine.getValue("A1").getErrorType());
        assertEquals(ErrorType.CIRCULAR_DEPENDENCY, engine.getValue("B1").getErrorType());
        assertEquals(ErrorType.CIRCULAR_DEPENDENCY, engine.getValue("C1").getErrorType());

        engine.setCell("B1", "3");

        assertEquals(CellValue.number(3), engine.getValue("A1"));
        assertEquals(CellValue.number(4), engine.getValue("C1"));
    }

    @Test
    void testSelfReference() {
        engine.setCell("A1", "=A1+1");
        assertEquals("#CIRC!", engine.getValue("A1").toDisplayString());
    }

    @Test
    void testInsertRowAboveInputsKeepsValues() {
        engine.setCell("A1", "10");
        engine.setCell("A2", "=A1*2");

        List<CellAddress> moved = engine.insertRows(0, 1);

        assertEquals(Arrays.asList(at("A2"), at("A3")), moved);
        assertFalse(engine.getCell("A1").isPresent());
        assertEquals("=A2*2", raw("A3"));
        assertEquals(CellValue.number(20), engine.getValue("A3"));
        assertEquals(Optional.of("Insert row 1"), engine.getUndoManager().peekUndo());
    }

    @Test
    void testDeletingAnInputGivesRefError() {
        engine.setCell("A1", "1");
        engine.setCell("A2", "=A1+1");

        engine.deleteRows(0, 1);

        assertEquals("=#REF!+1", raw("A1"));
        assertEquals(ErrorType.INVALID_REF, engine.getValue("A1").getErrorType());
    }

    @Test
    void testDeletingInsideARangeShrinksIt() {
        engine.setCell("A1", "1");
        engine.setCell("A2", "2");
        engine.setCell("A3", "3");
        engine.setCell("A4", "=SUM(A1:A3)");

        engine.deleteRows(1, 1);

        assertEquals("=SUM(A1:A2)", raw("A3"));
        assertEquals(CellValue.number(4), engine.getValue("A3"));
    }

    @Test
    void testColumnEdits() {
        engine.setCell("A1", "2");
        engine.setCell("B1", "=A1*3");

        engine.insertColumns(0, 2);
        assertEquals("=C1*3", raw("D1"));
        assertEquals(CellValue.number(6), engine.getValue("D1"));

        engine.deleteColumns(0, 2);
        assertEquals("=A1*3", raw("B1"));
        assertEquals(Optional.of("Delete 2 columns at A"), engine.getUndoManager().peekUndo());
    }

    @Test
    void testMoveRange() {
        engine.setCell("A1", "5");
        engine.setCell("B1", "=A1*2");

        engine.moveRange(CellRange.fromA1("A1"), at("C3"));

        assertFalse(engine.getCell("A1").isPresent());
        assertEquals("=C3*2", raw("B1"));
        assertEquals(CellValue.number(10), engine.getValue("B1"));

        engine.undo();
        assertEquals("5", raw("A1"));
        assertEquals("=A1*2", raw("B1"));
    }

    @Test
    void testStructuralNoOpIsNotRecorded() {
        assertTrue(engine.insertRows(0, 0).isEmpty());
        assertTrue(engine.moveRange(CellRange.fromA1("A1:B2"), at("A1")).isEmpty());
        assertFalse(engine.canUndo());
    }

    @Test
    void testFillCopiesFormulasWithRelativeReferences() {
        engine.setCell("A1", "1");
        engine.setCell("B1", "2");
        engine.setCell("A2", "10");
        engine.setCell("B2", "20");
        engine.setCell("C1", "=A1+B1");
        engine.setCell("D1", "=$A$1+B1");

        engine.fill(new FillOperation(CellRange.fromA1("C1:D1"), CellRange.fromA1("C2:D2"), FillDirection.DOWN));

        assertEquals("=A2+B2", raw("C2"));
        assertEquals("=$A$1+B2", raw("D2"));
        assertEquals(CellValue.number(30), engine.getValue("C2"));
        assertEquals(CellValue.number(21), engine.getValue("D2"));
    }

    /**
     * A fill is one undo step; preview computes the same cells without writing them.
     */
    @Test
    void testLinearFillAndUndo() {
        engine.setCell("A1", "1");
        engine.setCell("A2", "2");
        engine.setCell("A3", "3");
        FillOperation operation = new FillOperation(CellRange.fromA1("A1:A3"), CellRange.fromA1("A4:A6"),
                FillDirection.DOWN);

        FillResult preview = engine.preview(operation);
        assertEquals(3, preview.size());
        assertFalse(engine.getCell("A4").isPresent());

        engine.fill(operation);

        assertEquals(CellValue.number(4), engine.getValue("A4"));
        assertEquals(CellValue.number(5), engine.getValue("A5"));
        assertEquals(CellValue.number(6), engine.getValue("A6"));
        assertEquals(Optional.of("Fill A4:A6 from A1:A3"), engine.getUndoManager().peekUndo());

        engine.undo();
        assertFalse(engine.getCell("A4").isPresent());
        assertFalse(engine.getCell("A6").isPresent());
        assertEquals(CellValue.number(3), engine.getValue("A3"));
    }

    @Test
    void testBatchCommit() {
        engine.setCell("B1", "=A1*2");
        String id = engine.beginBatch();
        engine.addToBatch(id, BatchOperation.setCell(at("A1"), "42"));
        assertEquals(CellValue.EMPTY, engine.getValue("A1"));

        List<CellAddress> written = engine.commitBatch(id);

        assertEquals(Collections.singletonList(at("A1")), written);
        assertEquals(CellValue.number(42), engine.getValue("A1"));
        assertEquals(CellValue.number(84), engine.getValue("B1"));
        assertEquals(1, count(EventType.BATCH_COMPLETED));
        SpreadsheetEvent completed = events.stream()
                .filter(e -> e.getType() == EventType.BATCH_COMPLETED).findFirst().get();
        assertEquals(1, completed.getOperationCount());
        assertEquals(id, completed.getBatchId());

        engine.undo();
        assertEquals(CellValue.EMPTY, engine.getValue("A1"));
        assertEquals(CellValue.number(0), engine.getValue("B1"));
    }

    @Test
    void testBatchRollback() {
        String id = engine.beginBatch("edits");
        engine.addToBatch(id, BatchOperation.setCell(at("A1"), "1"));
        engine.rollbackBatch(id);

        assertThrows(BatchNotFoundException.class, () -> engine.commitBatch(id));
        assertFalse(engine.getCell("A1").isPresent());
        assertTrue(engine.getActiveBatches().isEmpty());
    }

    /**
     * A failing operation undoes the ones before it; nothing is recorded.
     */
    @Test
    void testFailedBatchIsReverted() {
        engine.setCell("A1", "1");
        String id = engine.beginBatch();
        engine.addToBatch(id, BatchOperation.setCell(at("A1"), "2"));
        engine.addToBatch(id, BatchOperation.setCell(at("A2"), "=1+"));

        assertThrows(FormulaParseException.class, () -> engine.commitBatch(id));

        assertEquals(CellValue.number(1), engine.getValue("A1"));
        assertFalse(engine.getCell("A2").isPresent());
        assertEquals(1, engine.getUndoHistory().size());
        assertTrue(engine.getActiveBatches().isEmpty());
    }

    @Test
    void testUndoRedoAcrossEdits() {
        engine.setCell("A1", "1");
        engine.setCell("B1", "=A1+1");
        engine.setCell("A1", "2");
        assertTrue(engine.deleteCell(at("A1")));
        engine.insertRows(0, 1);
        assertEquals("=A2+1", raw("B2"));

        assertEquals(Optional.of("Insert row 1"), engine.undo());
        assertEquals("=A1+1", raw("B1"));
        assertEquals(CellValue.number(1), engine.getValue("B1"));

        assertEquals(Optional.of("Delete cell A1"), engine.undo());
        assertEquals(CellValue.number(3), engine.getValue("B1"));

        assertEquals(Optional.of("Set cell A1"), engine.undo());
        assertEquals(CellValue.number(2), engine.getValue("B1"));

        assertEquals(Optional.of("Set cell A1"), engine.redo());
        assertEquals(CellValue.number(3), engine.getValue("B1"));
        assertEquals(Arrays.asList("Delete cell A1", "Insert row 1"), engine.getRedoHistory());
    }

    @Test
    void testDeleteMissingCell() {
        assertFalse(engine.deleteCell(at("Z9")));
        assertFalse(engine.canUndo());
    }

    @Test
    void testEvents() {
        engine.setCell("A1", "1");
        engine.deleteCell(at("A1"));
        engine.insertRows(0, 1);

        assertEquals(1, count(EventType.CELL_UPDATED));
        assertEquals(1, count(EventType.CELL_DELETED));
        assertEquals(1, count(EventType.STRUCTURE_CHANGED));
        assertTrue(count(EventType.CALCULATION_COMPLETED) >= 3);
        assertEquals(at("A1"), events.get(1).getAddress());
    }

    @Test
    void testDependencyViews() {
        engine.setCell("A1", "1");
        engine.setCell("B1", "=A1+A2");

        assertEquals(new TreeSet<>(Arrays.asList(at("A1"), at("A2"))),
                engine.getForwardDependencies().get(at("B1")));
        assertEquals(Collections.singleton(at("B1")), engine.getReverseDependencies().get(at("A1")));
    }

    @Test
    void testSheetQualifiedReferences() {
        engine.setCell("A1", "4");
        engine.setCell("B1", "=sheet1!A1*2");
        engine.setCell("B2", "=Other!A1");

        assertEquals(CellValue.number(8), engine.getValue("B1"));
        assertEquals(ErrorType.INVALID_REF, engine.getValue("B2").getErrorType());
    }

    @Test
    void testCustomFunctionsAndLimits() {
        EngineProperties properties = new EngineProperties();
        properties.setMaxUndo(2);
        FunctionLibrary functions = new FunctionLibrary();
        functions.register("TWICE", args -> CellValue.number(args.get(0).getNumber() * 2));
        SpreadsheetEngine custom = new SpreadsheetEngine(properties, functions);

        custom.setCell("A1", "=TWICE(21)");
        custom.setCell("A2", "1");
        custom.setCell("A3", "2");

        assertEquals(CellValue.number(42), custom.getValue("A1"));
        assertEquals(2, custom.getUndoHistory().size());
    }

    @Test
    void testRecalculateAll() {
        engine.setCell("A1", "1");
        engine.setCell("B1", "=A1");
        engine.setCell("B2", "=B1");

        assertEquals(Arrays.asList(at("B1"), at("B2")), engine.recalculate());
    }
}

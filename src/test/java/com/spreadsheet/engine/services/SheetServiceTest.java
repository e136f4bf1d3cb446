package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.FormulaParseException;
import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.fill.FillDirection;
import com.spreadsheet.engine.models.BatchRequest;
import com.spreadsheet.engine.models.CellResponse;
import com.spreadsheet.engine.models.FillRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class SheetServiceTest {

    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        sheetService = new SheetService();
        sheetId = sheetService.createSheet(null);
    }

    @Test
    void testCreateSheetUsesDefaultName() {
        assertEquals("Sheet1", sheetService.getSheet(sheetId).getName());

        long other = sheetService.createSheet("Expenses");
        assertNotEquals(sheetId, other);
        assertEquals("Expenses", sheetService.getSheet(other).getName());
    }

    /**
     * Each sheet resolves references qualified with its own name, not the default one.
     */
    @Test
    void testSheetQualifiedReferencesUseOwnName() {
        long expenses = sheetService.createSheet("Expenses");
        sheetService.setCell(expenses, "A1", "5");
        sheetService.setCell(expenses, "B1", "=Expenses!A1*2");
        sheetService.setCell(expenses, "C1", "=Sheet1!A1");

        Map<String, Object> data = sheetService.getSheetData(expenses);
        assertEquals(10.0, data.get("B1"));
        assertEquals("#REF!", data.get("C1"));

        sheetService.setCell(sheetId, "A1", "7");
        sheetService.setCell(sheetId, "B1", "=Sheet1!A1");
        assertEquals(7.0, sheetService.getSheetData(sheetId).get("B1"));
    }

    @Test
    void testUnknownSheet() {
        assertThrows(SheetNotFoundException.class, () -> sheetService.getSheet(-1));
        assertThrows(SheetNotFoundException.class, () -> sheetService.setCell(-1, "A1", "1"));
    }

    @Test
    void testSetAndGetCell() {
        sheetService.setCell(sheetId, "A1", "21");
        CellResponse response = sheetService.setCell(sheetId, "B1", "=A1*2");

        assertEquals("B1", response.getAddress());
        assertEquals("=A1*2", response.getRawText());
        assertEquals("42", response.getDisplay());

        Optional<CellResponse> cell = sheetService.getCell(sheetId, "B1");
        assertTrue(cell.isPresent());
        assertEquals(42.0, cell.get().getValue().getNumber());
        assertFalse(sheetService.getCell(sheetId, "Z99").isPresent());
    }

    /**
     * Addresses arrive from URL paths and are accepted in any case.
     */
    @Test
    void testLowercaseAddresses() {
        sheetService.setCell(sheetId, "b2", "hello");
        assertEquals("hello", sheetService.getSheetData(sheetId).get("B2"));
        assertTrue(sheetService.deleteCell(sheetId, " b2 "));
        assertFalse(sheetService.deleteCell(sheetId, "B2"));
    }

    @Test
    void testInvalidFormulaLeavesCellUnchanged() {
        sheetService.setCell(sheetId, "A1", "7");
        assertThrows(FormulaParseException.class, () -> sheetService.setCell(sheetId, "A1", "=1+*2"));
        assertEquals(7.0, sheetService.getSheetData(sheetId).get("A1"));
    }

    @Test
    void testSheetDataIsRowMajor() {
        sheetService.setCell(sheetId, "B2", "true");
        sheetService.setCell(sheetId, "A2", "x");
        sheetService.setCell(sheetId, "C1", "=1/0");

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(Arrays.asList("C1", "A2", "B2"), new ArrayList<>(data.keySet()));
        assertEquals("#DIV/0!", data.get("C1"));
        assertEquals(true, data.get("B2"));
    }

    /**
     * Partial re-eval: updating A1 refreshes B1 and C1 through the chain.
     */
    @Test
    void testPartialReEvaluation() {
        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "B1", "=A1+1");
        sheetService.setCell(sheetId, "C1", "=B1*10");
        assertEquals(20.0, sheetService.getSheetData(sheetId).get("C1"));

        sheetService.setCell(sheetId, "A1", "4");
        assertEquals(50.0, sheetService.getSheetData(sheetId).get("C1"));
    }

    @Test
    void testInsertAndDeleteRows() {
        sheetService.setCell(sheetId, "A1", "10");
        sheetService.setCell(sheetId, "A2", "=A1*2");

        assertEquals(Arrays.asList("A2", "A3"), sheetService.insertRows(sheetId, 0, 1));
        assertEquals(20.0, sheetService.getSheetData(sheetId).get("A3"));

        sheetService.deleteRows(sheetId, 1, 1);
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(Collections.singletonList("A2"), new ArrayList<>(data.keySet()));
        assertEquals("#REF!", data.get("A2"));
    }

    @Test
    void testInsertColumns() {
        sheetService.setCell(sheetId, "A1", "3");
        sheetService.setCell(sheetId, "B1", "=A1+1");

        sheetService.insertColumns(sheetId, 1, 1);
        assertEquals("=A1+1", sheetService.getCell(sheetId, "C1").get().getRawText());

        sheetService.deleteColumns(sheetId, 1, 1);
        assertEquals(4.0, sheetService.getSheetData(sheetId).get("B1"));
    }

    @Test
    void testFillAndPreview() {
        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "A2", "2");
        sheetService.setCell(sheetId, "B1", "=A1*10");

        FillRequest request = fillRequest("A1:A2", "A3:A4", FillDirection.DOWN);
        Map<String, Object> preview = sheetService.previewFill(sheetId, request);
        assertEquals(3.0, preview.get("A3"));
        assertEquals(4.0, preview.get("A4"));
        assertFalse(sheetService.getCell(sheetId, "A3").isPresent());

        Map<String, Object> filled = sheetService.fill(sheetId, request);
        assertEquals(Arrays.asList("A3", "A4"), new ArrayList<>(filled.keySet()));
        assertEquals(4.0, sheetService.getSheetData(sheetId).get("A4"));

        Map<String, Object> formulaPreview =
                sheetService.previewFill(sheetId, fillRequest("B1", "B2:B3", FillDirection.DOWN));
        assertEquals("=A2*10", formulaPreview.get("B2"));
        assertEquals("=A3*10", formulaPreview.get("B3"));
    }

    @Test
    void testFillNeedsRanges() {
        assertThrows(InvalidOperationException.class, () ->
                sheetService.fill(sheetId, fillRequest(null, "A3:A4", FillDirection.DOWN)));
    }

    @Test
    void testApplyBatch() {
        sheetService.setCell(sheetId, "C1", "old");
        BatchRequest request = new BatchRequest();
        request.setOperations(Arrays.asList(
                operation("set", "a1", "5"),
                operation("set", "B1", "=A1*3"),
                operation("delete", "C1", null)));

        List<String> affected = sheetService.applyBatch(sheetId, request);

        assertTrue(affected.containsAll(Arrays.asList("A1", "B1", "C1")));
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(15.0, data.get("B1"));
        assertFalse(data.containsKey("C1"));

        // one undo step for the whole batch
        sheetService.undo(sheetId);
        data = sheetService.getSheetData(sheetId);
        assertEquals(Collections.singletonList("C1"), new ArrayList<>(data.keySet()));
    }

    @Test
    void testBatchWithUnknownTypeAppliesNothing() {
        BatchRequest request = new BatchRequest();
        request.setOperations(Arrays.asList(
                operation("set", "A1", "1"),
                operation("rename", "A2", "x")));

        assertThrows(InvalidOperationException.class, () -> sheetService.applyBatch(sheetId, request));
        assertTrue(sheetService.getSheetData(sheetId).isEmpty());
    }

    @Test
    void testUndoRedo() {
        assertFalse(sheetService.undo(sheetId).isPresent());

        sheetService.setCell(sheetId, "A1", "1");
        sheetService.setCell(sheetId, "A1", "2");

        assertEquals(Optional.of("Set cell A1"), sheetService.undo(sheetId));
        assertEquals(1.0, sheetService.getSheetData(sheetId).get("A1"));
        assertTrue(sheetService.redo(sheetId).isPresent());
        assertEquals(2.0, sheetService.getSheetData(sheetId).get("A1"));
        assertFalse(sheetService.redo(sheetId).isPresent());
    }

    @Test
    void testDependencyMaps() {
        sheetService.setCell(sheetId, "C1", "=B1+A1");

        Map<String, Set<String>> forward = sheetService.getForwardDependencies(sheetId);
        assertEquals(Arrays.asList("A1", "B1"), new ArrayList<>(forward.get("C1")));

        Map<String, Set<String>> reverse = sheetService.getReverseDependencies(sheetId);
        assertEquals(Collections.singleton("C1"), reverse.get("A1"));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads write to the same sheet simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        sheetService.setCell(sheetId, "C1", "=SUM(A1:A50)+SUM(B1:B50)");

        Thread t1 = new Thread(() -> {
            for (int row = 1; row <= 50; row++) {
                sheetService.setCell(sheetId, "A" + row, "1");
            }
        });
        Thread t2 = new Thread(() -> {
            for (int row = 1; row <= 50; row++) {
                sheetService.setCell(sheetId, "B" + row, "2");
            }
        });

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(101, data.size());
        assertEquals(150.0, data.get("C1"));
    }

    private static FillRequest fillRequest(String source, String target, FillDirection direction) {
        FillRequest request = new FillRequest();
        request.setSource(source);
        request.setTarget(target);
        request.setDirection(direction);
        return request;
    }

    private static BatchRequest.Operation operation(String type, String address, String value) {
        BatchRequest.Operation op = new BatchRequest.Operation();
        op.setType(type);
        op.setAddress(address);
        op.setValue(value);
        return op;
    }
}

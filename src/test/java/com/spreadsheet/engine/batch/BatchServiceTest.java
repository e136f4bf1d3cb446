package com.spreadsheet.engine.batch;

import com.spreadsheet.engine.commands.BatchCommand;
import com.spreadsheet.engine.commands.InMemoryExecutor;
import com.spreadsheet.engine.events.EventDispatcher;
import com.spreadsheet.engine.events.EventType;
import com.spreadsheet.engine.events.SpreadsheetEvent;
import com.spreadsheet.engine.exceptions.BatchNotFoundException;
import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BatchServiceTest {

    private BatchService batchService;
    private InMemoryExecutor executor;
    private List<SpreadsheetEvent> events;
    private List<Set<CellAddress>> recalculations;

    @BeforeEach
    void setUp() {
        EventDispatcher dispatcher = new EventDispatcher();
        events = new ArrayList<>();
        dispatcher.addListener(events::add);
        batchService = new BatchService(new BatchManager(), dispatcher);
        executor = new InMemoryExecutor();
        recalculations = new ArrayList<>();
    }

    private static CellAddress at(String a1) {
        return CellAddress.fromA1(a1);
    }

    @Test
    void testGeneratedIds() {
        String first = batchService.beginBatch(null);
        String second = batchService.beginBatch(null);

        assertEquals("batch_1", first);
        assertEquals("batch_2", second);
        assertEquals(2, batchService.activeBatchIds().size());
        assertEquals(EventType.BATCH_STARTED, events.get(0).getType());
        assertThrows(InvalidOperationException.class, () -> batchService.beginBatch("batch_1"));
    }

    /**
     * Nothing is written until commit; commit recalculates once with every touched address.
     */
    @Test
    void testCommitAppliesInOrder() {
        String id = batchService.beginBatch("import");
        batchService.addOperation(id, BatchOperation.setCell(at("A1"), "1"));
        batchService.addOperation(id, BatchOperation.setCell(at("A1"), "2"));
        batchService.addOperation(id, BatchOperation.setRange(at("B1"), at("C2"),
                new String[][]{{"b1", "c1"}, {"b2", "c2"}}));
        assertEquals(0, executor.size());

        BatchCommand command = batchService.commitBatch(id, executor, recalculations::add);

        assertEquals("2", executor.text("A1"));
        assertEquals("c2", executor.text("C2"));
        assertEquals(6, command.size());
        assertEquals(1, recalculations.size());
        assertEquals(5, recalculations.get(0).size());
        assertFalse(batchService.hasBatch(id));

        SpreadsheetEvent completed = events.get(events.size() - 1);
        assertEquals(EventType.BATCH_COMPLETED, completed.getType());
        assertEquals("import", completed.getBatchId());
        assertEquals(3, completed.getOperationCount());
    }

    @Test
    void testUndoingTheCommittedBatch() {
        executor.setCellDirect(at("A2"), "old");
        String id = batchService.beginBatch(null);
        batchService.addOperation(id, BatchOperation.setCell(at("A1"), "new"));
        batchService.addOperation(id, BatchOperation.deleteRange(at("A2"), at("A3")));

        BatchCommand command = batchService.commitBatch(id, executor, recalculations::add);
        assertNull(executor.text("A2"));

        command.undo(executor);
        assertNull(executor.text("A1"));
        assertEquals("old", executor.text("A2"));
    }

    @Test
    void testRollbackDiscardsOperations() {
        String id = batchService.beginBatch(null);
        batchService.addOperation(id, BatchOperation.setCell(at("A1"), "1"));
        batchService.rollbackBatch(id);

        assertEquals(0, executor.size());
        assertThrows(BatchNotFoundException.class,
                () -> batchService.commitBatch(id, executor, recalculations::add));
        assertThrows(BatchNotFoundException.class, () -> batchService.rollbackBatch(id));
        assertThrows(BatchNotFoundException.class,
                () -> batchService.addOperation("missing", BatchOperation.deleteCell(at("A1"))));
    }

    @Test
    void testSetRangeShapeIsChecked() {
        assertThrows(InvalidOperationException.class, () -> BatchOperation.setRange(at("A1"), at("B2"),
                new String[][]{{"1", "2"}}));
        assertThrows(InvalidOperationException.class, () -> BatchOperation.setRange(at("A1"), at("B1"),
                new String[][]{{"1"}}));
    }

    @Test
    void testOperationCount() {
        BatchManager manager = new BatchManager();
        String id = manager.beginBatch(null);
        manager.addOperation(id, BatchOperation.deleteCell(at("A1")));
        manager.addOperation(id, BatchOperation.deleteCell(at("A2")));

        assertEquals(2, manager.operationCount(id));
        assertEquals(Arrays.asList(id), new ArrayList<>(manager.activeBatchIds()));
    }
}

package com.spreadsheet.engine.services;

import com.spreadsheet.engine.dependency.DependencyGraph;
import com.spreadsheet.engine.formula.FormulaParser;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.references.ReferenceAdjuster;
import com.spreadsheet.engine.references.ReferenceTracker;
import com.spreadsheet.engine.references.StructuralOperation;
import com.spreadsheet.engine.repository.CellRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class StructuralOperationsServiceTest {

    private CellRepository repository;
    private DependencyGraph graph;
    private ReferenceTracker tracker;
    private FormulaParser parser;
    private StructuralOperationsService service;

    @BeforeEach
    void setUp() {
        repository = new CellRepository();
        graph = new DependencyGraph();
        tracker = new ReferenceTracker();
        parser = new FormulaParser();
        service = new StructuralOperationsService(repository, graph, tracker, new ReferenceAdjuster(), parser);
    }

    private static CellAddress at(String a1) {
        return CellAddress.fromA1(a1);
    }

    private void put(String address, String text) {
        Cell cell = text.startsWith("=")
                ? Cell.formula(text, parser.parse(text))
                : Cell.literal(text, SpreadsheetEngine.parseLiteral(text));
        repository.put(at(address), cell);
        service.register(at(address), cell);
    }

    @Test
    void testCellsAndFormulasMoveTogether() {
        put("A1", "1");
        put("B1", "=A1*2");

        assertEquals(Arrays.asList(at("A2"), at("B2")), service.apply(StructuralOperation.insertRows(0, 1)));

        assertEquals("=A2*2", repository.get(at("B2")).get().getRawText());
        assertFalse(repository.contains(at("A1")));
        assertEquals(Collections.singleton(at("A2")), graph.getDependencies(at("B2")));
        assertEquals(Collections.singleton(at("B2")), tracker.getDependents(at("A2")));
        assertTrue(tracker.getDependents(at("A1")).isEmpty());
    }

    /**
     * Cells in deleted lines are dropped; references to them become #REF!.
     */
    @Test
    void testDeleteDropsCells() {
        put("A1", "1");
        put("B1", "x");
        put("A2", "=A1+B3");
        put("B3", "2");

        assertEquals(Arrays.asList(at("A1"), at("B2")), service.apply(StructuralOperation.deleteRows(0, 1)));

        assertEquals("=#REF!+B2", repository.get(at("A1")).get().getRawText());
        assertEquals(2, repository.size());
    }

    @Test
    void testMoveOverwritesTarget() {
        put("A1", "moved");
        put("C1", "overwritten");

        service.apply(StructuralOperation.moveRange(CellRange.fromA1("A1"), at("C1")));

        assertEquals(CellValue.string("moved"), repository.get(at("C1")).get().getComputedValue());
        assertEquals(1, repository.size());
    }

    @Test
    void testNoOp() {
        put("A1", "1");
        assertTrue(service.apply(StructuralOperation.deleteColumns(3, 0)).isEmpty());
        assertTrue(repository.contains(at("A1")));
    }

    @Test
    void testUnregisterKeepsReferencedNode() {
        put("A1", "1");
        put("B1", "=A1");

        service.unregister(at("A1"));
        assertTrue(graph.contains(at("A1")));

        service.unregister(at("B1"));
        service.unregister(at("A1"));
        assertFalse(graph.contains(at("A1")));
    }
}

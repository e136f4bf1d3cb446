package com.spreadsheet.engine.dependency;

import com.spreadsheet.engine.exceptions.CircularDependencyException;
import com.spreadsheet.engine.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static final CellAddress A1 = CellAddress.fromA1("A1");
    private static final CellAddress A2 = CellAddress.fromA1("A2");
    private static final CellAddress A3 = CellAddress.fromA1("A3");
    private static final CellAddress B1 = CellAddress.fromA1("B1");

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    void testEdgesAreKeptInBothDirections() {
        graph.addDependency(A2, A1);
        graph.addDependency(A3, A1);

        assertEquals(Collections.singleton(A1), graph.getDependencies(A2));
        assertTrue(graph.getDependents(A1).containsAll(Arrays.asList(A2, A3)));
        assertTrue(graph.getDependencies(A1).isEmpty());
        assertEquals(3, graph.size());
    }

    /**
     * Replacing a formula drops its outgoing edges but keeps the node and its dependents.
     */
    @Test
    void testRemoveDependenciesFor() {
        graph.addDependency(A2, A1);
        graph.addDependency(A3, A2);

        graph.removeDependenciesFor(A2);

        assertTrue(graph.contains(A2));
        assertTrue(graph.getDependencies(A2).isEmpty());
        assertTrue(graph.getDependents(A1).isEmpty());
        assertEquals(Collections.singleton(A3), graph.getDependents(A2));
    }

    /**
     * Empty cells that were only ever referenced leave the graph once nothing points at them.
     */
    @Test
    void testTargetOnlyNodesArePruned() {
        graph.addCell(A2);
        graph.addDependency(A2, B1);
        assertTrue(graph.contains(B1));

        graph.removeDependenciesFor(A2);

        assertFalse(graph.contains(B1));
        assertTrue(graph.contains(A2));
        assertEquals(Collections.singletonList(A2), graph.getCalculationOrder());
    }

    @Test
    void testDetachCellKeepsReferencedAddress() {
        graph.addCell(A1);
        graph.addDependency(A2, A1);
        graph.addDependency(A1, B1);

        graph.detachCell(A1);

        // A2 still points at the deleted cell
        assertTrue(graph.contains(A1));
        assertFalse(graph.contains(B1));
        assertEquals(Collections.singleton(A2), graph.getDependents(A1));

        graph.removeDependenciesFor(A2);
        assertFalse(graph.contains(A1));
        assertEquals(1, graph.size());
    }

    @Test
    void testRemoveCell() {
        graph.addDependency(A2, A1);
        graph.addDependency(A3, A2);

        graph.removeCell(A2);

        assertFalse(graph.contains(A2));
        assertTrue(graph.getDependencies(A3).isEmpty());
        assertTrue(graph.getDependents(A1).isEmpty());
    }

    @Test
    void testCalculationOrder() {
        graph.addDependency(A3, A2);
        graph.addDependency(A2, A1);
        graph.addDependency(A3, B1);

        List<CellAddress> order = graph.getCalculationOrder();

        assertEquals(4, order.size());
        assertTrue(order.indexOf(A1) < order.indexOf(A2));
        assertTrue(order.indexOf(A2) < order.indexOf(A3));
        assertTrue(order.indexOf(B1) < order.indexOf(A3));
        // ties broken row-major
        assertEquals(Arrays.asList(A1, B1, A2, A3), order);
    }

    @Test
    void testCalculationOrderRejectsCycles() {
        graph.addDependency(A1, A2);
        graph.addDependency(A2, A1);
        graph.addCell(B1);

        CircularDependencyException ex = assertThrows(CircularDependencyException.class,
                () -> graph.getCalculationOrder());
        assertEquals(Arrays.asList(A1, A2), ex.getCells());
    }

    @Test
    void testWouldCreateCycle() {
        graph.addDependency(A2, A1);
        graph.addDependency(A3, A2);

        assertTrue(graph.wouldCreateCycle(A1, A3));
        assertTrue(graph.wouldCreateCycle(B1, B1));
        assertFalse(graph.wouldCreateCycle(A3, A1));
        assertFalse(graph.wouldCreateCycle(B1, A1));
        // the check itself adds nothing
        assertFalse(graph.getDependencies(A1).contains(A3));
    }

    @Test
    void testGraphViewsAreSnapshots() {
        graph.addDependency(A2, A1);

        assertEquals(Collections.singleton(A1), graph.getForwardGraph().get(A2));
        assertEquals(Collections.singleton(A2), graph.getReverseGraph().get(A1));
        assertThrows(UnsupportedOperationException.class, () -> graph.getForwardGraph().clear());

        graph.clear();
        assertTrue(graph.isEmpty());
    }
}

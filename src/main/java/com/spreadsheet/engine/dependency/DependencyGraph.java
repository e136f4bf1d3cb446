package com.spreadsheet.engine.dependency;

import com.spreadsheet.engine.exceptions.CircularDependencyException;
import com.spreadsheet.engine.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph of "cell depends on cell" edges.
 * An edge from -> to means from's formula references to.
 *
 * Two adjacency maps are kept in step:
 * - forward: cell -> cells it references
 * - reverse: cell -> cells that reference it
 *
 * A node that is only ever a reference target (an empty cell some formula
 * points at) is dropped as soon as nothing points at it any more.
 */
public class DependencyGraph {

    private final Map<CellAddress, Set<CellAddress>> forward = new HashMap<>();
    private final Map<CellAddress, Set<CellAddress>> reverse = new HashMap<>();
    // nodes added as cells (addCell or the dependent side of an edge)
    private final Set<CellAddress> cells = new HashSet<>();

    /**
     * Adds a node with no edges, if absent.
     */
    public void addCell(CellAddress address) {
        cells.add(address);
        forward.computeIfAbsent(address, k -> new LinkedHashSet<>());
        reverse.computeIfAbsent(address, k -> new LinkedHashSet<>());
    }

    /**
     * Records that 'from' depends on 'to'. Both become nodes of the graph.
     */
    public void addDependency(CellAddress from, CellAddress to) {
        cells.add(from);
        forward.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        forward.computeIfAbsent(to, k -> new LinkedHashSet<>());

        reverse.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
        reverse.computeIfAbsent(from, k -> new LinkedHashSet<>());
    }

    /**
     * Drops the outgoing edges of a cell (its formula was replaced).
     * The node and the edges pointing at it stay.
     */
    public void removeDependenciesFor(CellAddress address) {
        Set<CellAddress> oldTargets = forward.get(address);
        if (oldTargets == null) {
            return;
        }
        List<CellAddress> targets = new ArrayList<>(oldTargets);
        oldTargets.clear();
        for (CellAddress target : targets) {
            Set<CellAddress> dependents = reverse.get(target);
            if (dependents != null) {
                dependents.remove(address);
            }
            pruneIfUnused(target);
        }
    }

    /**
     * The cell was deleted: its outgoing edges go, and the node goes too
     * unless other formulas still reference the address.
     */
    public void detachCell(CellAddress address) {
        cells.remove(address);
        removeDependenciesFor(address);
        pruneIfUnused(address);
    }

    /**
     * Removes a cell and every edge touching it.
     */
    public void removeCell(CellAddress address) {
        cells.remove(address);
        removeDependenciesFor(address);
        Set<CellAddress> dependents = reverse.remove(address);
        if (dependents != null) {
            for (CellAddress dependent : dependents) {
                Set<CellAddress> targets = forward.get(dependent);
                if (targets != null) {
                    targets.remove(address);
                }
            }
        }
        forward.remove(address);
    }

    /**
     * Cells whose formulas reference the given cell directly.
     */
    public Set<CellAddress> getDependents(CellAddress address) {
        return Collections.unmodifiableSet(reverse.getOrDefault(address, Collections.emptySet()));
    }

    /**
     * Cells the given cell's formula references directly.
     */
    public Set<CellAddress> getDependencies(CellAddress address) {
        return Collections.unmodifiableSet(forward.getOrDefault(address, Collections.emptySet()));
    }

    /**
     * Orders every node so that each cell comes after everything it depends on.
     * Ties are broken row-major, so the order is stable for a given graph.
     *
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public List<CellAddress> getCalculationOrder() {
        Map<CellAddress, Integer> pending = new HashMap<>();
        PriorityQueue<CellAddress> ready = new PriorityQueue<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : forward.entrySet()) {
            pending.put(entry.getKey(), entry.getValue().size());
            if (entry.getValue().isEmpty()) {
                ready.add(entry.getKey());
            }
        }

        List<CellAddress> order = new ArrayList<>(forward.size());
        while (!ready.isEmpty()) {
            CellAddress next = ready.poll();
            order.add(next);
            for (CellAddress dependent : reverse.getOrDefault(next, Collections.emptySet())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < forward.size()) {
            Set<CellAddress> stuck = new TreeSet<>(forward.keySet());
            stuck.removeAll(order);
            throw new CircularDependencyException("Circular dependency among " + stuck, new ArrayList<>(stuck));
        }
        return order;
    }

    /**
     * Whether adding the edge from -> to would close a cycle.
     * Answers by searching for a path from 'to' back to 'from'; the graph is not touched.
     */
    public boolean wouldCreateCycle(CellAddress from, CellAddress to) {
        if (from.equals(to)) {
            return true;
        }
        if (!forward.containsKey(from) || !forward.containsKey(to)) {
            return false;
        }
        Deque<CellAddress> stack = new ArrayDeque<>();
        Set<CellAddress> visited = new HashSet<>();
        stack.push(to);
        while (!stack.isEmpty()) {
            CellAddress current = stack.pop();
            if (current.equals(from)) {
                return true;
            }
            if (visited.add(current)) {
                for (CellAddress next : forward.getOrDefault(current, Collections.emptySet())) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    public boolean contains(CellAddress address) {
        return forward.containsKey(address);
    }

    public int size() {
        return forward.size();
    }

    public boolean isEmpty() {
        return forward.isEmpty();
    }

    public void clear() {
        forward.clear();
        reverse.clear();
        cells.clear();
    }

    private void pruneIfUnused(CellAddress address) {
        if (cells.contains(address)) {
            return;
        }
        if (forward.getOrDefault(address, Collections.emptySet()).isEmpty()
                && reverse.getOrDefault(address, Collections.emptySet()).isEmpty()) {
            forward.remove(address);
            reverse.remove(address);
        }
    }

    /**
     * Read-only copy of the forward adjacency, keyed and ordered by address.
     */
    public Map<CellAddress, Set<CellAddress>> getForwardGraph() {
        return copyOf(forward);
    }

    /**
     * Read-only copy of the reverse adjacency, keyed and ordered by address.
     */
    public Map<CellAddress, Set<CellAddress>> getReverseGraph() {
        return copyOf(reverse);
    }

    private static Map<CellAddress, Set<CellAddress>> copyOf(Map<CellAddress, Set<CellAddress>> adjacency) {
        Map<CellAddress, Set<CellAddress>> copy = new TreeMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : adjacency.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }
}

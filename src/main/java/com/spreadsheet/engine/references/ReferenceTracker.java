package com.spreadsheet.engine.references;

import com.spreadsheet.engine.formula.BinaryOpExpr;
import com.spreadsheet.engine.formula.Expr;
import com.spreadsheet.engine.formula.ExprVisitor;
import com.spreadsheet.engine.formula.FunctionCallExpr;
import com.spreadsheet.engine.formula.LiteralExpr;
import com.spreadsheet.engine.formula.RangeExpr;
import com.spreadsheet.engine.formula.ReferenceExpr;
import com.spreadsheet.engine.formula.UnaryOpExpr;
import com.spreadsheet.engine.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Remembers which cells each formula references, in both directions,
 * and answers "what has to be recalculated when these cells change".
 */
public class ReferenceTracker {

    // cell -> cells its formula references
    private final Map<CellAddress, Set<CellAddress>> dependencies = new HashMap<>();
    // cell -> cells whose formulas reference it
    private final Map<CellAddress, Set<CellAddress>> dependents = new HashMap<>();

    /**
     * Replaces the recorded references of a cell with those found in its formula.
     *
     * @return the referenced cells (ranges expanded)
     */
    public Set<CellAddress> updateDependencies(CellAddress cell, Expr formula) {
        removeDependencies(cell);
        Set<CellAddress> references = extractReferences(formula);
        if (references.isEmpty()) {
            return references;
        }
        dependencies.put(cell, new LinkedHashSet<>(references));
        for (CellAddress target : references) {
            dependents.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(cell);
        }
        return references;
    }

    /**
     * Forgets the references of a cell (the cell itself may still be referenced).
     */
    public void removeDependencies(CellAddress cell) {
        Set<CellAddress> old = dependencies.remove(cell);
        if (old == null) {
            return;
        }
        for (CellAddress target : old) {
            Set<CellAddress> reverse = dependents.get(target);
            if (reverse != null) {
                reverse.remove(cell);
                if (reverse.isEmpty()) {
                    dependents.remove(target);
                }
            }
        }
    }

    public Set<CellAddress> getDependencies(CellAddress cell) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellAddress> getDependents(CellAddress cell) {
        return Collections.unmodifiableSet(dependents.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Whether making 'from' reference 'to' would close a loop.
     */
    public boolean wouldCreateCycle(CellAddress from, CellAddress to) {
        if (from.equals(to)) {
            return true;
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
                stack.addAll(dependencies.getOrDefault(current, Collections.emptySet()));
            }
        }
        return false;
    }

    /**
     * The changed cells plus everything that transitively depends on them,
     * ordered so that each cell comes after the cells it depends on.
     * Cycles do not fail here; the evaluator reports them as #CIRC! values.
     */
    public List<CellAddress> getAffectedCells(Collection<CellAddress> changed) {
        Set<CellAddress> affected = new HashSet<>();
        Deque<CellAddress> queue = new ArrayDeque<>(changed);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            if (affected.add(current)) {
                queue.addAll(dependents.getOrDefault(current, Collections.emptySet()));
            }
        }

        // post-order DFS restricted to the affected set: dependencies first
        List<CellAddress> order = new ArrayList<>(affected.size());
        Set<CellAddress> visited = new HashSet<>();
        for (CellAddress start : new TreeSet<>(affected)) {
            visit(start, affected, visited, order);
        }
        return order;
    }

    private void visit(CellAddress start, Set<CellAddress> affected, Set<CellAddress> visited,
                       List<CellAddress> order) {
        if (!visited.add(start)) {
            return;
        }
        // explicit stack so long chains cannot overflow the call stack
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, sortedDependencies(start, affected).iterator()));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.children.hasNext()) {
                CellAddress child = frame.children.next();
                if (visited.add(child)) {
                    stack.push(new Frame(child, sortedDependencies(child, affected).iterator()));
                }
            } else {
                stack.pop();
                order.add(frame.cell);
            }
        }
    }

    private static final class Frame {
        final CellAddress cell;
        final Iterator<CellAddress> children;

        Frame(CellAddress cell, Iterator<CellAddress> children) {
            this.cell = cell;
            this.children = children;
        }
    }

    private List<CellAddress> sortedDependencies(CellAddress cell, Set<CellAddress> affected) {
        List<CellAddress> result = new ArrayList<>();
        for (CellAddress dependency : new TreeSet<>(dependencies.getOrDefault(cell, Collections.emptySet()))) {
            if (affected.contains(dependency)) {
                result.add(dependency);
            }
        }
        return result;
    }

    public void clear() {
        dependencies.clear();
        dependents.clear();
    }

    /**
     * Every cell a formula references, with ranges expanded cell by cell.
     */
    public static Set<CellAddress> extractReferences(Expr formula) {
        Set<CellAddress> result = new LinkedHashSet<>();
        if (formula != null) {
            formula.accept(new ReferenceCollector(result));
        }
        return result;
    }

    private static final class ReferenceCollector implements ExprVisitor<Void> {

        private final Set<CellAddress> out;

        ReferenceCollector(Set<CellAddress> out) {
            this.out = out;
        }

        @Override
        public Void visitLiteral(LiteralExpr expr) {
            return null;
        }

        @Override
        public Void visitReference(ReferenceExpr expr) {
            out.add(expr.getAddress());
            return null;
        }

        @Override
        public Void visitRange(RangeExpr expr) {
            for (CellAddress address : expr.getRange()) {
                out.add(address);
            }
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCallExpr expr) {
            for (Expr arg : expr.getArgs()) {
                arg.accept(this);
            }
            return null;
        }

        @Override
        public Void visitUnaryOp(UnaryOpExpr expr) {
            return expr.getOperand().accept(this);
        }

        @Override
        public Void visitBinaryOp(BinaryOpExpr expr) {
            expr.getLeft().accept(this);
            return expr.getRight().accept(this);
        }
    }
}

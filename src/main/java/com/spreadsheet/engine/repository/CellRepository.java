package com.spreadsheet.engine.repository;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory store of the cells of one sheet, keyed by address.
 * Not thread-safe; the owning session serializes access.
 */
public class CellRepository {

    private final Map<CellAddress, Cell> cells = new HashMap<>();

    public Optional<Cell> get(CellAddress address) {
        return Optional.ofNullable(cells.get(address));
    }

    /**
     * Stores a cell, returning the one it replaced (or null).
     */
    public Cell put(CellAddress address, Cell cell) {
        return cells.put(address, cell);
    }

    public Cell remove(CellAddress address) {
        return cells.remove(address);
    }

    public boolean contains(CellAddress address) {
        return cells.containsKey(address);
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public void clear() {
        cells.clear();
    }

    /**
     * All occupied addresses in row-major order.
     */
    public List<CellAddress> addresses() {
        List<CellAddress> result = new ArrayList<>(cells.keySet());
        Collections.sort(result);
        return result;
    }

    /**
     * Snapshot of every cell, ordered row-major. The map is a copy; the cells are not.
     */
    public Map<CellAddress, Cell> entries() {
        return new TreeMap<>(cells);
    }

    /**
     * Occupied cells inside the range, row-major. Walks whichever side is smaller,
     * so a whole-column range over a sparse sheet stays cheap.
     */
    public Map<CellAddress, Cell> findInRange(CellRange range) {
        Map<CellAddress, Cell> result = new TreeMap<>();
        if (range.size() <= cells.size()) {
            for (CellAddress address : range) {
                Cell cell = cells.get(address);
                if (cell != null) {
                    result.put(address, cell);
                }
            }
        } else {
            for (Map.Entry<CellAddress, Cell> entry : cells.entrySet()) {
                if (range.contains(entry.getKey())) {
                    result.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return result;
    }
}

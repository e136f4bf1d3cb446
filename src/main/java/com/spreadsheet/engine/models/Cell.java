package com.spreadsheet.engine.models;

import com.spreadsheet.engine.formula.Expr;

/**
 * Represents one cell's content:
 * - rawText: exactly what the user typed ("=A1+1", "42", "hello")
 * - formula: the parsed tree when rawText starts with '=', otherwise null
 * - computedValue: the result of the last calculation
 *
 * A new Cell replaces the old one on every write; only the computed value
 * is refreshed in place when dependencies recalculate.
 */
public class Cell {

    private final String rawText;
    private final Expr formula;
    private CellValue computedValue;

    public Cell(String rawText, Expr formula, CellValue computedValue) {
        if (formula != null && (rawText == null || !rawText.startsWith("="))) {
            throw new IllegalArgumentException("Formula cells must have raw text starting with '=': " + rawText);
        }
        this.rawText = rawText == null ? "" : rawText;
        this.formula = formula;
        this.computedValue = computedValue == null ? CellValue.EMPTY : computedValue;
    }

    public static Cell literal(String rawText, CellValue value) {
        return new Cell(rawText, null, value);
    }

    public static Cell formula(String rawText, Expr formula) {
        return new Cell(rawText, formula, CellValue.EMPTY);
    }

    public String getRawText() {
        return rawText;
    }

    public Expr getFormula() {
        return formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public CellValue getComputedValue() {
        return computedValue;
    }

    public void setComputedValue(CellValue computedValue) {
        this.computedValue = computedValue == null ? CellValue.EMPTY : computedValue;
    }

    /**
     * Detached copy, used for undo snapshots.
     */
    public Cell copy() {
        return new Cell(rawText, formula, computedValue);
    }

    @Override
    public String toString() {
        return "Cell{" + rawText + " -> " + computedValue + "}";
    }
}

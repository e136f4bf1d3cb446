package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellRange;

import java.util.Objects;

/**
 * A rectangular range such as A1:B10. Only legal as a function argument.
 */
public final class RangeExpr extends Expr {

    private final CellRange range;
    private final boolean absoluteStartCol;
    private final boolean absoluteStartRow;
    private final boolean absoluteEndCol;
    private final boolean absoluteEndRow;
    private final String sheetName;

    public RangeExpr(CellRange range, boolean absoluteStartCol, boolean absoluteStartRow,
                     boolean absoluteEndCol, boolean absoluteEndRow, String sheetName) {
        this.range = Objects.requireNonNull(range, "range");
        this.absoluteStartCol = absoluteStartCol;
        this.absoluteStartRow = absoluteStartRow;
        this.absoluteEndCol = absoluteEndCol;
        this.absoluteEndRow = absoluteEndRow;
        this.sheetName = sheetName;
    }

    public RangeExpr(CellRange range) {
        this(range, false, false, false, false, null);
    }

    public CellRange getRange() {
        return range;
    }

    public boolean isAbsoluteStartCol() {
        return absoluteStartCol;
    }

    public boolean isAbsoluteStartRow() {
        return absoluteStartRow;
    }

    public boolean isAbsoluteEndCol() {
        return absoluteEndCol;
    }

    public boolean isAbsoluteEndRow() {
        return absoluteEndRow;
    }

    public String getSheetName() {
        return sheetName;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public String toFormulaString() {
        String prefix = sheetName == null ? "" : sheetName + "!";
        return prefix + ReferenceExpr.format(range.getStart(), absoluteStartCol, absoluteStartRow)
                + ":" + ReferenceExpr.format(range.getEnd(), absoluteEndCol, absoluteEndRow);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeExpr)) return false;
        RangeExpr that = (RangeExpr) o;
        return absoluteStartCol == that.absoluteStartCol && absoluteStartRow == that.absoluteStartRow
                && absoluteEndCol == that.absoluteEndCol && absoluteEndRow == that.absoluteEndRow
                && range.equals(that.range) && Objects.equals(sheetName, that.sheetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(range, absoluteStartCol, absoluteStartRow, absoluteEndCol, absoluteEndRow, sheetName);
    }
}

package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellAddress;

import java.util.Objects;

/**
 * A single-cell reference such as A1, $A$1 or Sheet1!B2.
 */
public final class ReferenceExpr extends Expr {

    private final CellAddress address;
    private final boolean absoluteCol;
    private final boolean absoluteRow;
    // null when the reference is not sheet-qualified
    private final String sheetName;

    public ReferenceExpr(CellAddress address, boolean absoluteCol, boolean absoluteRow) {
        this(address, absoluteCol, absoluteRow, null);
    }

    public ReferenceExpr(CellAddress address, boolean absoluteCol, boolean absoluteRow, String sheetName) {
        this.address = Objects.requireNonNull(address, "address");
        this.absoluteCol = absoluteCol;
        this.absoluteRow = absoluteRow;
        this.sheetName = sheetName;
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isAbsoluteCol() {
        return absoluteCol;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    public String getSheetName() {
        return sheetName;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public String toFormulaString() {
        String prefix = sheetName == null ? "" : sheetName + "!";
        return prefix + format(address, absoluteCol, absoluteRow);
    }

    static String format(CellAddress address, boolean absoluteCol, boolean absoluteRow) {
        return (absoluteCol ? "$" : "") + CellAddress.columnNumberToLabel(address.getCol())
                + (absoluteRow ? "$" : "") + (address.getRow() + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceExpr)) return false;
        ReferenceExpr that = (ReferenceExpr) o;
        return absoluteCol == that.absoluteCol && absoluteRow == that.absoluteRow
                && address.equals(that.address) && Objects.equals(sheetName, that.sheetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, absoluteCol, absoluteRow, sheetName);
    }
}

package com.spreadsheet.engine.references;

import com.spreadsheet.engine.models.CellAddress;

import java.util.Objects;

/**
 * A reference found in formula text, with the exact substring it was read from
 * and its [start, end) offsets, so it can be rewritten in place.
 *
 * Cell kinds (RELATIVE, ABSOLUTE, MIXED_COL, MIXED_ROW) carry an address.
 * RANGE carries two cell references; SHEET carries a sheet name and an inner reference.
 */
public final class Reference {

    private final ReferenceType type;
    private final CellAddress address;
    private final Reference rangeStart;
    private final Reference rangeEnd;
    private final String sheetName;
    private final Reference inner;
    private final String text;
    private final int start;
    private final int end;

    private Reference(ReferenceType type, CellAddress address, Reference rangeStart, Reference rangeEnd,
                      String sheetName, Reference inner, String text, int start, int end) {
        this.type = type;
        this.address = address;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.sheetName = sheetName;
        this.inner = inner;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public static Reference cell(CellAddress address, boolean absoluteCol, boolean absoluteRow,
                                 String text, int start) {
        ReferenceType type;
        if (absoluteCol && absoluteRow) {
            type = ReferenceType.ABSOLUTE;
        } else if (absoluteCol) {
            type = ReferenceType.MIXED_COL;
        } else if (absoluteRow) {
            type = ReferenceType.MIXED_ROW;
        } else {
            type = ReferenceType.RELATIVE;
        }
        return new Reference(type, address, null, null, null, null, text, start, start + text.length());
    }

    public static Reference range(Reference rangeStart, Reference rangeEnd, String text, int start) {
        return new Reference(ReferenceType.RANGE, null, rangeStart, rangeEnd, null, null,
                text, start, start + text.length());
    }

    public static Reference sheet(String sheetName, Reference inner, String text, int start) {
        return new Reference(ReferenceType.SHEET, null, null, null, sheetName, inner,
                text, start, start + text.length());
    }

    public ReferenceType getType() {
        return type;
    }

    public boolean isCell() {
        return address != null;
    }

    /**
     * Address of a cell reference; null for RANGE and SHEET.
     */
    public CellAddress getAddress() {
        return address;
    }

    public boolean isAbsoluteCol() {
        return type == ReferenceType.ABSOLUTE || type == ReferenceType.MIXED_COL;
    }

    public boolean isAbsoluteRow() {
        return type == ReferenceType.ABSOLUTE || type == ReferenceType.MIXED_ROW;
    }

    public Reference getRangeStart() {
        return rangeStart;
    }

    public Reference getRangeEnd() {
        return rangeEnd;
    }

    public String getSheetName() {
        return sheetName;
    }

    public Reference getInner() {
        return inner;
    }

    /**
     * The substring this reference was read from.
     */
    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Formats an address with the same '$' markers as this cell reference.
     */
    public String format(CellAddress newAddress) {
        return (isAbsoluteCol() ? "$" : "") + CellAddress.columnNumberToLabel(newAddress.getCol())
                + (isAbsoluteRow() ? "$" : "") + (newAddress.getRow() + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference that = (Reference) o;
        return start == that.start && type == that.type && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, start);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + start;
    }
}

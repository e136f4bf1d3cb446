package com.spreadsheet.engine.references;

import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

/**
 * An insertion, deletion or relocation of whole rows, columns or a block of cells.
 * Created for a single edit, then handed to the reference adjuster and to
 * cell-address remapping.
 */
public final class StructuralOperation {

    public enum Kind {
        INSERT_ROWS,
        INSERT_COLUMNS,
        DELETE_ROWS,
        DELETE_COLUMNS,
        MOVE_RANGE
    }

    private final Kind kind;
    // before_row / before_col / start_row / start_col, depending on kind
    private final int index;
    private final int count;
    private final CellRange from;
    private final CellRange to;

    private StructuralOperation(Kind kind, int index, int count, CellRange from, CellRange to) {
        this.kind = kind;
        this.index = index;
        this.count = count;
        this.from = from;
        this.to = to;
    }

    public static StructuralOperation insertRows(int beforeRow, int count) {
        return lineOperation(Kind.INSERT_ROWS, beforeRow, count);
    }

    public static StructuralOperation insertColumns(int beforeCol, int count) {
        return lineOperation(Kind.INSERT_COLUMNS, beforeCol, count);
    }

    public static StructuralOperation deleteRows(int startRow, int count) {
        return lineOperation(Kind.DELETE_ROWS, startRow, count);
    }

    public static StructuralOperation deleteColumns(int startCol, int count) {
        return lineOperation(Kind.DELETE_COLUMNS, startCol, count);
    }

    /**
     * Moves the block 'from' so that its top-left corner lands on 'toTopLeft'.
     */
    public static StructuralOperation moveRange(CellRange from, CellAddress toTopLeft) {
        long lastRow = (long) toTopLeft.getRow() + from.rowCount() - 1;
        long lastCol = (long) toTopLeft.getCol() + from.columnCount() - 1;
        if (lastRow >= CellAddress.MAX_ROWS || lastCol >= CellAddress.MAX_COLUMNS) {
            throw new InvalidOperationException("Move target " + toTopLeft.toA1() + " runs off the sheet");
        }
        CellRange to = new CellRange(toTopLeft, new CellAddress((int) lastCol, (int) lastRow));
        return new StructuralOperation(Kind.MOVE_RANGE, 0, 0, from, to);
    }

    private static StructuralOperation lineOperation(Kind kind, int index, int count) {
        if (index < 0 || count < 0) {
            throw new InvalidOperationException(kind + " needs a non-negative index and count, got index="
                    + index + ", count=" + count);
        }
        return new StructuralOperation(kind, index, count, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public int getCount() {
        return count;
    }

    public CellRange getFrom() {
        return from;
    }

    public CellRange getTo() {
        return to;
    }

    public boolean isNoOp() {
        return kind == Kind.MOVE_RANGE ? from.equals(to) : count == 0;
    }

    /**
     * Where a cell (or a reference to it) ends up after this operation.
     *
     * @return the new address, or null if the cell is deleted, overwritten by a move,
     *         or pushed past the edge of the sheet
     */
    public CellAddress apply(CellAddress address) {
        switch (kind) {
            case INSERT_ROWS:
                if (address.getRow() < index) {
                    return address;
                }
                return shifted(address, count, 0);
            case INSERT_COLUMNS:
                if (address.getCol() < index) {
                    return address;
                }
                return shifted(address, 0, count);
            case DELETE_ROWS:
                if (address.getRow() < index) {
                    return address;
                }
                if (address.getRow() < index + count) {
                    return null;
                }
                return shifted(address, -count, 0);
            case DELETE_COLUMNS:
                if (address.getCol() < index) {
                    return address;
                }
                if (address.getCol() < index + count) {
                    return null;
                }
                return shifted(address, 0, -count);
            default:
                if (from.contains(address)) {
                    return shifted(address,
                            to.getStart().getRow() - from.getStart().getRow(),
                            to.getStart().getCol() - from.getStart().getCol());
                }
                if (to.contains(address)) {
                    return null;
                }
                return address;
        }
    }

    private static CellAddress shifted(CellAddress address, int rowDelta, int colDelta) {
        long row = (long) address.getRow() + rowDelta;
        long col = (long) address.getCol() + colDelta;
        if (row < 0 || col < 0 || row >= CellAddress.MAX_ROWS || col >= CellAddress.MAX_COLUMNS) {
            return null;
        }
        return new CellAddress((int) col, (int) row);
    }

    @Override
    public String toString() {
        if (kind == Kind.MOVE_RANGE) {
            return "MoveRange{from=" + from.toA1() + ", to=" + to.toA1() + "}";
        }
        return kind + "{index=" + index + ", count=" + count + "}";
    }
}

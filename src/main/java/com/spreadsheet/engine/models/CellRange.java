package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidRangeException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A rectangular block of cells, start = top-left, end = bottom-right (inclusive).
 * Iterating a range walks its cells row by row; every iteration starts afresh.
 */
public final class CellRange implements Iterable<CellAddress> {

    private final CellAddress start;
    private final CellAddress end;

    /**
     * @throws InvalidRangeException if start is not above-left of (or equal to) end
     */
    public CellRange(CellAddress start, CellAddress end) {
        if (start.getCol() > end.getCol() || start.getRow() > end.getRow()) {
            throw new InvalidRangeException("Range corners out of order: "
                    + start.toA1() + ":" + end.toA1());
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Builds the range covering both corners, whatever order they come in.
     */
    public static CellRange spanning(CellAddress a, CellAddress b) {
        return new CellRange(
                new CellAddress(Math.min(a.getCol(), b.getCol()), Math.min(a.getRow(), b.getRow())),
                new CellAddress(Math.max(a.getCol(), b.getCol()), Math.max(a.getRow(), b.getRow())));
    }

    public static CellRange single(CellAddress address) {
        return new CellRange(address, address);
    }

    /**
     * Parses "A1:B2". A single address ("A1") is accepted as a one-cell range.
     */
    public static CellRange fromA1(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidRangeException("Empty range");
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return single(CellAddress.fromA1(text));
        }
        return new CellRange(
                CellAddress.fromA1(text.substring(0, colon)),
                CellAddress.fromA1(text.substring(colon + 1)));
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public boolean contains(CellAddress address) {
        return address.getCol() >= start.getCol() && address.getCol() <= end.getCol()
                && address.getRow() >= start.getRow() && address.getRow() <= end.getRow();
    }

    public int rowCount() {
        return end.getRow() - start.getRow() + 1;
    }

    public int columnCount() {
        return end.getCol() - start.getCol() + 1;
    }

    public long size() {
        return (long) rowCount() * columnCount();
    }

    public String toA1() {
        return start.toA1() + ":" + end.toA1();
    }

    @Override
    public Iterator<CellAddress> iterator() {
        return new Iterator<CellAddress>() {
            private int col = start.getCol();
            private int row = start.getRow();

            @Override
            public boolean hasNext() {
                return row <= end.getRow();
            }

            @Override
            public CellAddress next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CellAddress current = new CellAddress(col, row);
                if (col < end.getCol()) {
                    col++;
                } else {
                    col = start.getCol();
                    row++;
                }
                return current;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellRange)) return false;
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return toA1();
    }
}

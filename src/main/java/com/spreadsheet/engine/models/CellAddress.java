package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidAddressException;
import com.spreadsheet.engine.exceptions.InvalidReferenceException;

import java.util.Objects;

/**
 * A cell coordinate: 0-based column and row.
 * Displayed in A1 notation, where the row is shown as row+1.
 * Addresses order row-major (row first, then column).
 */
public final class CellAddress implements Comparable<CellAddress> {

    // Excel-compatible sheet limits; XFD is the last column
    public static final int MAX_COLUMNS = 16384;
    public static final int MAX_ROWS = 1048576;

    private final int col;
    private final int row;

    public CellAddress(int col, int row) {
        if (col < 0 || row < 0) {
            throw new InvalidAddressException("Negative coordinates: col=" + col + ", row=" + row);
        }
        this.col = col;
        this.row = row;
    }

    public static CellAddress of(int col, int row) {
        return new CellAddress(col, row);
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    /**
     * Parses A1 notation ("B12"). Only uppercase column letters are accepted.
     * A column past XFD or a row past the sheet ceiling is a #REF! condition.
     */
    public static CellAddress fromA1(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidAddressException("Empty address");
        }
        int i = 0;
        while (i < text.length() && text.charAt(i) >= 'A' && text.charAt(i) <= 'Z') {
            i++;
        }
        String letters = text.substring(0, i);
        String digits = text.substring(i);
        if (letters.isEmpty() || digits.isEmpty()) {
            throw new InvalidAddressException("Invalid address: " + text);
        }
        for (int j = 0; j < digits.length(); j++) {
            if (!isAsciiDigit(digits.charAt(j))) {
                throw new InvalidAddressException("Invalid address: " + text);
            }
        }
        long rowNumber = parseRowNumber(digits, text);
        if (rowNumber == 0) {
            throw new InvalidAddressException("Row numbers start at 1: " + text);
        }
        long colIndex = columnLabelToLong(letters);
        if (colIndex >= MAX_COLUMNS) {
            throw new InvalidReferenceException("Column out of range: " + text);
        }
        if (rowNumber > MAX_ROWS) {
            throw new InvalidReferenceException("Row out of range: " + text);
        }
        return new CellAddress((int) colIndex, (int) rowNumber - 1);
    }

    public String toA1() {
        return columnNumberToLabel(col) + (row + 1);
    }

    /**
     * Returns this address moved by the given deltas.
     *
     * @throws InvalidAddressException if the result would be negative
     */
    public CellAddress offset(int rowOffset, int colOffset) {
        long newRow = (long) row + rowOffset;
        long newCol = (long) col + colOffset;
        if (newRow < 0 || newCol < 0) {
            throw new InvalidAddressException("Offset (" + rowOffset + ", " + colOffset
                    + ") moves " + toA1() + " off the sheet");
        }
        return new CellAddress((int) newCol, (int) newRow);
    }

    public boolean isWithinBounds(int maxRow, int maxCol) {
        return row <= maxRow && col <= maxCol;
    }

    /**
     * 0 -> A, 25 -> Z, 26 -> AA, 701 -> ZZ, 702 -> AAA.
     */
    public static String columnNumberToLabel(int col) {
        if (col < 0) {
            throw new InvalidAddressException("Negative column: " + col);
        }
        StringBuilder label = new StringBuilder();
        int n = col;
        while (true) {
            label.insert(0, (char) ('A' + n % 26));
            if (n < 26) {
                break;
            }
            n = n / 26 - 1;
        }
        return label.toString();
    }

    /**
     * Inverse of {@link #columnNumberToLabel(int)}.
     */
    public static int columnLabelToNumber(String label) {
        long value = columnLabelToLong(label);
        if (value > Integer.MAX_VALUE) {
            throw new InvalidAddressException("Column label too long: " + label);
        }
        return (int) value;
    }

    private static long columnLabelToLong(String label) {
        if (label == null || label.isEmpty()) {
            throw new InvalidAddressException("Empty column label");
        }
        if (label.length() > 7) {
            // anything this long is far past XFD; report it as off the sheet
            return Long.MAX_VALUE;
        }
        long result = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Invalid column label: " + label);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result - 1;
    }

    private static long parseRowNumber(String digits, String text) {
        String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
        if (trimmed.length() > 10) {
            throw new InvalidReferenceException("Row out of range: " + text);
        }
        return Long.parseLong(trimmed);
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellAddress)) return false;
        CellAddress that = (CellAddress) o;
        return col == that.col && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(col, row);
    }

    @Override
    public String toString() {
        return toA1();
    }

    // 0-9 only; other Unicode digits are plain text
    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

package com.spreadsheet.engine.references;

import com.spreadsheet.engine.models.CellAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every reference in formula text by walking it character by character.
 *
 * Recognised shapes: [$]COL[$]ROW, REF:REF and Name!REF (or Name!REF:REF).
 * String literals, error literals and function names are skipped, so
 * ="A1" and LOG10(2) contain no references. References past the edge of the
 * sheet (XFE1) are not references either; the parser reports those.
 */
public class ReferenceScanner {

    /**
     * @return references in textual order; empty for text without a leading '='
     */
    public List<Reference> scan(String formula) {
        List<Reference> references = new ArrayList<>();
        if (formula == null || !formula.startsWith("=")) {
            return references;
        }

        int i = 1;
        int length = formula.length();
        while (i < length) {
            char c = formula.charAt(i);
            if (c == '"') {
                i = skipString(formula, i);
            } else if (c == '#') {
                i = skipErrorLiteral(formula, i);
            } else if (c == '$' || isLetter(c) || c == '_') {
                i = scanWord(formula, i, references);
            } else {
                i++;
            }
        }
        return references;
    }

    // Reads one identifier-like word starting at 'start' and records it if it is a reference
    private int scanWord(String formula, int start, List<Reference> out) {
        int runEnd = start;
        while (runEnd < formula.length() && isWordChar(formula.charAt(runEnd))) {
            runEnd++;
        }

        // Sheet1!A1 or Sheet1!A1:B2
        if (formula.charAt(start) != '$' && runEnd < formula.length() && formula.charAt(runEnd) == '!') {
            String sheetName = formula.substring(start, runEnd);
            Reference inner = readCellOrRange(formula, runEnd + 1);
            if (inner != null) {
                out.add(Reference.sheet(sheetName, inner, formula.substring(start, inner.getEnd()), start));
                return inner.getEnd();
            }
            return runEnd + 1;
        }

        Reference reference = readCellOrRange(formula, start);
        if (reference != null) {
            out.add(reference);
            return reference.getEnd();
        }
        return Math.max(runEnd, start + 1);
    }

    private Reference readCellOrRange(String formula, int start) {
        Reference first = readCell(formula, start);
        if (first == null) {
            return null;
        }
        if (first.getEnd() < formula.length() && formula.charAt(first.getEnd()) == ':') {
            Reference second = readCell(formula, first.getEnd() + 1);
            if (second != null) {
                return Reference.range(first, second, formula.substring(start, second.getEnd()), start);
            }
        }
        return first;
    }

    /**
     * Matches [$]LETTERS[$]DIGITS at 'start'. Returns null when the text there is not a
     * reference: no match, a longer word (A1B, LOG10X), a function name (LOG10(...)),
     * or an address off the sheet.
     */
    private Reference readCell(String formula, int start) {
        int i = start;
        int length = formula.length();
        boolean absoluteCol = false;
        if (i < length && formula.charAt(i) == '$') {
            absoluteCol = true;
            i++;
        }
        int lettersStart = i;
        while (i < length && isLetter(formula.charAt(i))) {
            i++;
        }
        int lettersEnd = i;
        if (lettersEnd == lettersStart) {
            return null;
        }
        boolean absoluteRow = false;
        if (i < length && formula.charAt(i) == '$') {
            absoluteRow = true;
            i++;
        }
        int digitsStart = i;
        while (i < length && isAsciiDigit(formula.charAt(i))) {
            i++;
        }
        if (i == digitsStart) {
            return null;
        }
        if (i < length && isWordChar(formula.charAt(i))) {
            return null;
        }
        if (nextNonSpace(formula, i) == '(') {
            return null;
        }

        long col = columnIndex(formula.substring(lettersStart, lettersEnd));
        long row = rowNumber(formula.substring(digitsStart, i));
        if (col < 0 || col >= CellAddress.MAX_COLUMNS || row < 1 || row > CellAddress.MAX_ROWS) {
            return null;
        }
        CellAddress address = new CellAddress((int) col, (int) row - 1);
        return Reference.cell(address, absoluteCol, absoluteRow, formula.substring(start, i), start);
    }

    private static long columnIndex(String letters) {
        if (letters.length() > 3) {
            return -1;
        }
        long result = 0;
        for (int k = 0; k < letters.length(); k++) {
            result = result * 26 + (Character.toUpperCase(letters.charAt(k)) - 'A' + 1);
        }
        return result - 1;
    }

    private static long rowNumber(String digits) {
        String trimmed = digits.replaceFirst("^0+", "");
        if (trimmed.isEmpty()) {
            return 0;
        }
        if (trimmed.length() > 7) {
            return -1;
        }
        return Long.parseLong(trimmed);
    }

    private static int skipString(String formula, int start) {
        int i = start + 1;
        while (i < formula.length()) {
            if (formula.charAt(i) == '"') {
                if (i + 1 < formula.length() && formula.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    // #REF!, #DIV/0!, #NAME? ...
    private static int skipErrorLiteral(String formula, int start) {
        int i = start + 1;
        while (i < formula.length()) {
            char c = formula.charAt(i);
            if (c == '!' || c == '?') {
                return i + 1;
            }
            if (!isLetter(c) && !isAsciiDigit(c) && c != '/') {
                return i;
            }
            i++;
        }
        return i;
    }

    private static char nextNonSpace(String formula, int from) {
        int i = from;
        while (i < formula.length() && Character.isWhitespace(formula.charAt(i))) {
            i++;
        }
        return i < formula.length() ? formula.charAt(i) : '\0';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    // 0-9 only; other Unicode digits are plain text
    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

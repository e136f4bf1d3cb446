package com.spreadsheet.engine.references;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.references.StructuralOperation.Kind;

import java.util.List;

/**
 * Rewrites the references inside formula text.
 *
 * Replacements are applied from the last reference to the first so that
 * earlier offsets stay valid. Only coordinates change; '$' markers are kept,
 * except that a reference to a removed cell becomes the literal #REF!.
 */
public class ReferenceAdjuster {

    public static final String REF_ERROR = "#REF!";

    private final ReferenceScanner scanner;

    public ReferenceAdjuster() {
        this(new ReferenceScanner());
    }

    public ReferenceAdjuster(ReferenceScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Rewrites a formula for a structural edit. Text without a leading '=' is returned as is.
     */
    public String adjustFormula(String formula, StructuralOperation operation) {
        if (formula == null || !formula.startsWith("=") || operation.isNoOp()) {
            return formula;
        }
        return rewrite(formula, new StructuralRule(operation));
    }

    /**
     * Shifts the relative coordinates of every reference by the given deltas, as when a
     * formula is copied from one cell to another. Absolute coordinates stay put; a
     * reference pushed off the sheet becomes #REF!.
     */
    public String translateFormula(String formula, int rowDelta, int colDelta) {
        if (formula == null || !formula.startsWith("=") || (rowDelta == 0 && colDelta == 0)) {
            return formula;
        }
        return rewrite(formula, new TranslationRule(rowDelta, colDelta));
    }

    private String rewrite(String formula, Rule rule) {
        List<Reference> references = scanner.scan(formula);
        StringBuilder result = new StringBuilder(formula);
        for (int i = references.size() - 1; i >= 0; i--) {
            Reference reference = references.get(i);
            String replacement = adjustReference(reference, rule);
            if (replacement != null && !replacement.equals(reference.getText())) {
                result.replace(reference.getStart(), reference.getEnd(), replacement);
            }
        }
        return result.toString();
    }

    /**
     * @return the rewritten text, or null to leave the reference untouched
     */
    private String adjustReference(Reference reference, Rule rule) {
        switch (reference.getType()) {
            case RANGE:
                return rule.adjustRange(reference.getRangeStart(), reference.getRangeEnd());
            case SHEET:
                String inner = adjustReference(reference.getInner(), rule);
                if (inner == null) {
                    return null;
                }
                if (REF_ERROR.equals(inner)) {
                    return REF_ERROR;
                }
                return reference.getSheetName() + "!" + inner;
            default:
                CellAddress moved = rule.adjustCell(reference);
                return moved == null ? REF_ERROR : reference.format(moved);
        }
    }

    private interface Rule {

        /**
         * @return the new address, or null if the reference no longer has a target
         */
        CellAddress adjustCell(Reference cell);

        /**
         * @return the rewritten range text, or null to leave it untouched
         */
        String adjustRange(Reference start, Reference end);
    }

    private static final class StructuralRule implements Rule {

        private final StructuralOperation operation;

        StructuralRule(StructuralOperation operation) {
            this.operation = operation;
        }

        @Override
        public CellAddress adjustCell(Reference cell) {
            return operation.apply(cell.getAddress());
        }

        @Override
        public String adjustRange(Reference start, Reference end) {
            Kind kind = operation.getKind();
            if (kind == Kind.DELETE_ROWS || kind == Kind.DELETE_COLUMNS) {
                return shrinkRange(start, end, kind == Kind.DELETE_ROWS);
            }
            CellAddress newStart = operation.apply(start.getAddress());
            CellAddress newEnd = operation.apply(end.getAddress());
            if (kind == Kind.MOVE_RANGE) {
                // endpoints that cannot follow the move keep their text
                newStart = newStart == null ? start.getAddress() : newStart;
                newEnd = newEnd == null ? end.getAddress() : newEnd;
                if (newStart.getCol() > newEnd.getCol() || newStart.getRow() > newEnd.getRow()) {
                    return null;
                }
            } else if (newStart == null) {
                return REF_ERROR;
            } else if (newEnd == null) {
                // insertion pushed the end past the sheet edge; clamp to the last line
                newEnd = kind == Kind.INSERT_ROWS
                        ? new CellAddress(end.getAddress().getCol(), CellAddress.MAX_ROWS - 1)
                        : new CellAddress(CellAddress.MAX_COLUMNS - 1, end.getAddress().getRow());
            }
            return start.format(newStart) + ":" + end.format(newEnd);
        }

        // A range loses the deleted lines; if nothing is left it becomes #REF!
        private String shrinkRange(Reference start, Reference end, boolean rows) {
            int first = operation.getIndex();
            int afterLast = first + operation.getCount();
            int lo = rows ? start.getAddress().getRow() : start.getAddress().getCol();
            int hi = rows ? end.getAddress().getRow() : end.getAddress().getCol();
            if (lo > hi) {
                // written bottom-up (A5:A1)
                return shrinkRange(end, start, rows);
            }

            int newLo = lo < first ? lo : (lo >= afterLast ? lo - operation.getCount() : first);
            int newHi = hi < first ? hi : (hi >= afterLast ? hi - operation.getCount() : first - 1);
            if (newHi < newLo) {
                return REF_ERROR;
            }
            CellAddress newStart = rows
                    ? new CellAddress(start.getAddress().getCol(), newLo)
                    : new CellAddress(newLo, start.getAddress().getRow());
            CellAddress newEnd = rows
                    ? new CellAddress(end.getAddress().getCol(), newHi)
                    : new CellAddress(newHi, end.getAddress().getRow());
            return start.format(newStart) + ":" + end.format(newEnd);
        }
    }

    private static final class TranslationRule implements Rule {

        private final int rowDelta;
        private final int colDelta;

        TranslationRule(int rowDelta, int colDelta) {
            this.rowDelta = rowDelta;
            this.colDelta = colDelta;
        }

        @Override
        public CellAddress adjustCell(Reference cell) {
            CellAddress address = cell.getAddress();
            long row = cell.isAbsoluteRow() ? address.getRow() : (long) address.getRow() + rowDelta;
            long col = cell.isAbsoluteCol() ? address.getCol() : (long) address.getCol() + colDelta;
            if (row < 0 || col < 0 || row >= CellAddress.MAX_ROWS || col >= CellAddress.MAX_COLUMNS) {
                return null;
            }
            return new CellAddress((int) col, (int) row);
        }

        @Override
        public String adjustRange(Reference start, Reference end) {
            CellAddress newStart = adjustCell(start);
            CellAddress newEnd = adjustCell(end);
            if (newStart == null || newEnd == null) {
                return REF_ERROR;
            }
            return start.format(newStart) + ":" + end.format(newEnd);
        }
    }
}

package com.spreadsheet.engine.evaluator;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellValue;

/**
 * What the evaluator needs from the outside world: cell values and the
 * stack of cells currently being evaluated.
 */
public interface EvaluationContext {

    /**
     * Current value of a cell; Empty for an unset cell. Never throws for
     * value-level problems, which come back as error values.
     */
    CellValue getCellValue(CellAddress address);

    /**
     * Whether the cell is somewhere on the evaluation stack right now.
     */
    boolean isEvaluating(CellAddress address);

    void pushEvaluation(CellAddress address);

    void popEvaluation(CellAddress address);

    /**
     * Whether a sheet-qualified reference points into the sheet being evaluated.
     */
    default boolean isLocalSheet(String sheetName) {
        return true;
    }
}

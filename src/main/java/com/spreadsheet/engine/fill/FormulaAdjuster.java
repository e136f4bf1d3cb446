package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.references.ReferenceAdjuster;

/**
 * Moves a formula from one cell to another the way copy/fill does:
 * relative references follow, absolute ones stay.
 */
public class FormulaAdjuster {

    private final ReferenceAdjuster adjuster;

    public FormulaAdjuster(ReferenceAdjuster adjuster) {
        this.adjuster = adjuster;
    }

    public String adjustFormula(String formula, CellAddress from, CellAddress to) {
        return adjuster.translateFormula(formula, to.getRow() - from.getRow(), to.getCol() - from.getCol());
    }
}

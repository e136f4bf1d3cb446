package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellValue;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of a fill: generated values, and formulas for targets whose source held a formula.
 * An address appears in at most one of the two maps.
 */
public class FillResult {

    private final Map<CellAddress, CellValue> affectedCells;
    private final Map<CellAddress, String> formulasAdjusted;

    public FillResult(Map<CellAddress, CellValue> affectedCells, Map<CellAddress, String> formulasAdjusted) {
        this.affectedCells = Collections.unmodifiableMap(new TreeMap<>(affectedCells));
        this.formulasAdjusted = Collections.unmodifiableMap(new TreeMap<>(formulasAdjusted));
    }

    public Map<CellAddress, CellValue> getAffectedCells() {
        return affectedCells;
    }

    public Map<CellAddress, String> getFormulasAdjusted() {
        return formulasAdjusted;
    }

    public int size() {
        return affectedCells.size() + formulasAdjusted.size();
    }
}

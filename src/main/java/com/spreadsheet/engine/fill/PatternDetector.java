package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.models.CellValue;

import java.util.List;
import java.util.Optional;

/**
 * Recognises one kind of series in a lane of source values and extends it.
 * Source values are always given in fill order, so the last one is nearest the target.
 */
public interface PatternDetector {

    PatternType.Kind getKind();

    /**
     * Higher runs first.
     */
    int getPriority();

    boolean canHandle(List<CellValue> values);

    Optional<PatternType> detect(List<CellValue> values);

    /**
     * @throws com.spreadsheet.engine.exceptions.InvalidOperationException if the source
     *         has nothing the pattern can continue from
     */
    List<CellValue> generate(List<CellValue> source, PatternType pattern, int count);
}

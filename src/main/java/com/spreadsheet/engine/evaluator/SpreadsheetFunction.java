package com.spreadsheet.engine.evaluator;

import com.spreadsheet.engine.models.CellValue;

import java.util.List;

/**
 * A built-in or user-registered function. Range arguments arrive as array values.
 * Implementations report problems as error values rather than throwing.
 */
@FunctionalInterface
public interface SpreadsheetFunction {

    CellValue apply(List<CellValue> args);
}

package com.spreadsheet.engine.references;

/**
 * How a reference was written.
 */
public enum ReferenceType {
    // A1
    RELATIVE,
    // $A$1
    ABSOLUTE,
    // $A1: column fixed
    MIXED_COL,
    // A$1: row fixed
    MIXED_ROW,
    // A1:B2
    RANGE,
    // Sheet1!A1
    SHEET
}

package com.spreadsheet.engine.exceptions;

/**
 * Thrown when attempting to access a sheet ID
 * that doesn't exist in the in-memory store.
 */
public class SheetNotFoundException extends SpreadsheetException {
    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
    }
}

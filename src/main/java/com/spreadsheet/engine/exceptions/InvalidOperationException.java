package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a request is well formed but cannot be carried out,
 * e.g. a negative row count or a fill whose source and target do not line up.
 */
public class InvalidOperationException extends SpreadsheetException {

    public InvalidOperationException(String message) {
        super(message);
    }
}

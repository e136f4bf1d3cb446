package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.ErrorType;

/**
 * Thrown when address text cannot be read as A1 notation,
 * or when an address computation would leave the sheet.
 */
public class InvalidAddressException extends SpreadsheetException {

    public InvalidAddressException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_REF;
    }
}

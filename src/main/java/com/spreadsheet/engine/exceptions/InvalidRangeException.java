package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.ErrorType;

/**
 * Thrown when a range is built with its corners out of order or from bad text.
 */
public class InvalidRangeException extends SpreadsheetException {

    public InvalidRangeException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_RANGE;
    }
}

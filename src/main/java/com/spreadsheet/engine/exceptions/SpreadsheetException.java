package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.ErrorType;

/**
 * Base class of every hard failure raised by the engine.
 * Hard failures abort the requested operation; when one has to be stored
 * as a cell value instead, {@link #getErrorType()} gives the value-level mapping.
 */
public class SpreadsheetException extends RuntimeException {

    public SpreadsheetException(String message) {
        super(message);
    }

    public SpreadsheetException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorType getErrorType() {
        return ErrorType.INVALID_OPERATION;
    }
}

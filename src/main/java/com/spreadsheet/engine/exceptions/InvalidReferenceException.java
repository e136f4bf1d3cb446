package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.ErrorType;

/**
 * A reference that is well formed but points outside the sheet,
 * e.g. a column past XFD. Reported as #REF! rather than a plain parse error.
 */
public class InvalidReferenceException extends FormulaParseException {

    public InvalidReferenceException(String message) {
        super("#REF! " + message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_REF;
    }
}

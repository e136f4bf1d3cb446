package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.ErrorType;

/**
 * Thrown when formula text is not syntactically valid.
 */
public class FormulaParseException extends SpreadsheetException {

    private final int position;

    public FormulaParseException(String message) {
        this(message, -1);
    }

    public FormulaParseException(String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.position = position;
    }

    /**
     * Offset into the formula body where parsing failed, or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }

    @Override
    public ErrorType getErrorType() {
        String message = getMessage();
        if (message != null && message.contains("#REF!")) {
            return ErrorType.INVALID_REF;
        }
        if (message != null && message.contains("Unknown function")) {
            return ErrorType.NAME_ERROR;
        }
        return ErrorType.PARSE_ERROR;
    }
}

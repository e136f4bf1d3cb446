package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.ErrorType;

/**
 * A formula that parses but cannot be evaluated as written,
 * such as a range used outside a function argument.
 */
public class InvalidFormulaException extends SpreadsheetException {

    public InvalidFormulaException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PARSE_ERROR;
    }
}

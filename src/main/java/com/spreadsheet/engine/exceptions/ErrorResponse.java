package com.spreadsheet.engine.exceptions;

/**
 * Body of every error reply, for example:
 * {
 *   "code": "INVALID_FORMULA",
 *   "message": "Unexpected token ')' at position 3"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

package com.spreadsheet.engine.models;

/**
 * The closed set of calculation errors a cell value can carry.
 * Each type maps to exactly one Excel-style display code; the codes are
 * what any client renders, so they must not change.
 */
public enum ErrorType {
    DIVIDE_BY_ZERO("#DIV/0!"),
    INVALID_REF("#REF!"),
    NAME_ERROR("#NAME?"),
    VALUE_ERROR("#VALUE!"),
    CIRCULAR_DEPENDENCY("#CIRC!"),
    NUM_ERROR("#NUM!"),
    PARSE_ERROR("#ERROR!"),
    INVALID_RANGE("#ERROR!"),
    INVALID_ARGUMENTS("#ERROR!"),
    INVALID_OPERATION("#ERROR!");

    private final String code;

    ErrorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves an error literal as it appears in formula text ("#REF!", "#DIV/0!" ...).
     * "#ERROR!" is shared by several types and resolves to PARSE_ERROR, the first declared.
     *
     * @return the matching type, or null if the text is not an error code
     */
    public static ErrorType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String upper = code.toUpperCase();
        for (ErrorType type : values()) {
            if (type.code.equals(upper)) {
                return type;
            }
        }
        return null;
    }
}

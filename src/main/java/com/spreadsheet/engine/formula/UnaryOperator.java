package com.spreadsheet.engine.formula;

public enum UnaryOperator {
    NEGATE,
    PERCENT
}

package com.spreadsheet.engine.formula;

/**
 * Infix operators with their binding power (higher binds tighter).
 */
public enum BinaryOperator {
    CONCAT("&", 0),
    EQUAL("=", 1),
    NOT_EQUAL("<>", 1),
    LESS_THAN("<", 1),
    LESS_THAN_OR_EQUAL("<=", 1),
    GREATER_THAN(">", 1),
    GREATER_THAN_OR_EQUAL(">=", 1),
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 3),
    DIVIDE("/", 3),
    POWER("^", 4);

    // unary operators sit above every infix operator
    public static final int NEGATE_PRECEDENCE = 5;
    public static final int PERCENT_PRECEDENCE = 6;

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    public boolean isComparison() {
        return precedence == 1;
    }
}

package com.spreadsheet.engine.formula;

/**
 * A node of a parsed formula. Trees are immutable.
 */
public abstract class Expr {

    public abstract <T> T accept(ExprVisitor<T> visitor);

    /**
     * Canonical formula text for this node, without the leading '='.
     */
    public abstract String toFormulaString();

    @Override
    public String toString() {
        return toFormulaString();
    }
}

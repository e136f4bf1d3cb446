package com.spreadsheet.engine.formula;

import java.util.Objects;

public final class BinaryOpExpr extends Expr {

    private final BinaryOperator operator;
    private final Expr left;
    private final Expr right;

    public BinaryOpExpr(BinaryOperator operator, Expr left, Expr right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toFormulaString() {
        return wrap(left, false) + operator.getSymbol() + wrap(right, true);
    }

    // parenthesize a child only where precedence would otherwise change the tree
    private String wrap(Expr child, boolean rightSide) {
        if (child instanceof BinaryOpExpr) {
            BinaryOperator childOp = ((BinaryOpExpr) child).operator;
            boolean needsParens = childOp.getPrecedence() < operator.getPrecedence()
                    || (childOp.getPrecedence() == operator.getPrecedence()
                    && rightSide != operator.isRightAssociative());
            if (needsParens) {
                return "(" + child.toFormulaString() + ")";
            }
        }
        return child.toFormulaString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryOpExpr)) return false;
        BinaryOpExpr that = (BinaryOpExpr) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }
}

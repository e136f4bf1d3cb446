package com.spreadsheet.engine.formula;

import java.util.Objects;

public final class UnaryOpExpr extends Expr {

    private final UnaryOperator operator;
    private final Expr operand;

    public UnaryOpExpr(UnaryOperator operator, Expr operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toFormulaString() {
        String inner = operand instanceof BinaryOpExpr ? "(" + operand.toFormulaString() + ")"
                : operand.toFormulaString();
        return operator == UnaryOperator.NEGATE ? "-" + inner : inner + "%";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnaryOpExpr)) return false;
        UnaryOpExpr that = (UnaryOpExpr) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }
}

package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;

import java.util.Objects;

public final class LiteralExpr extends Expr {

    private final CellValue value;

    public LiteralExpr(CellValue value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toFormulaString() {
        if (value.isString()) {
            return "\"" + value.getString().replace("\"", "\"\"") + "\"";
        }
        return value.toDisplayString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralExpr)) return false;
        return value.equals(((LiteralExpr) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}

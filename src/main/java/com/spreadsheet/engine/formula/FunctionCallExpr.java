package com.spreadsheet.engine.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class FunctionCallExpr extends Expr {

    private final String name;
    private final List<Expr> args;

    public FunctionCallExpr(String name, List<Expr> args) {
        this.name = name.toUpperCase();
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Function name, always uppercase.
     */
    public String getName() {
        return name;
    }

    public List<Expr> getArgs() {
        return args;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toFormulaString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(args.get(i).toFormulaString());
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionCallExpr)) return false;
        FunctionCallExpr that = (FunctionCallExpr) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }
}

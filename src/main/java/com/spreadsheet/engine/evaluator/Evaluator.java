package com.spreadsheet.engine.evaluator;

import com.spreadsheet.engine.exceptions.InvalidFormulaException;
import com.spreadsheet.engine.formula.BinaryOpExpr;
import com.spreadsheet.engine.formula.Expr;
import com.spreadsheet.engine.formula.ExprVisitor;
import com.spreadsheet.engine.formula.FunctionCallExpr;
import com.spreadsheet.engine.formula.LiteralExpr;
import com.spreadsheet.engine.formula.RangeExpr;
import com.spreadsheet.engine.formula.ReferenceExpr;
import com.spreadsheet.engine.formula.UnaryOpExpr;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellError;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Walks an expression tree against an {@link EvaluationContext}.
 *
 * Value-level problems (type mismatch, division by zero, unknown function,
 * a reference back into a cell still being evaluated) produce error values.
 * The only hard failure is a range used outside a function argument.
 */
public class Evaluator {

    private final FunctionLibrary functions;

    public Evaluator(FunctionLibrary functions) {
        this.functions = functions;
    }

    public FunctionLibrary getFunctions() {
        return functions;
    }

    /**
     * @throws InvalidFormulaException if the tree uses a range outside a function call
     */
    public CellValue evaluate(Expr expr, EvaluationContext context) {
        return expr.accept(new Walk(context));
    }

    private final class Walk implements ExprVisitor<CellValue> {

        private final EvaluationContext context;

        Walk(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public CellValue visitLiteral(LiteralExpr expr) {
            return expr.getValue();
        }

        @Override
        public CellValue visitReference(ReferenceExpr expr) {
            if (expr.getSheetName() != null && !context.isLocalSheet(expr.getSheetName())) {
                return CellValue.error(ErrorType.INVALID_REF, "Unknown sheet: " + expr.getSheetName());
            }
            CellAddress address = expr.getAddress();
            if (context.isEvaluating(address)) {
                return CellValue.error(CellError.circular(Collections.singletonList(address)));
            }
            return context.getCellValue(address);
        }

        @Override
        public CellValue visitRange(RangeExpr expr) {
            throw new InvalidFormulaException("Range expressions can only be used as function arguments: "
                    + expr.toFormulaString());
        }

        @Override
        public CellValue visitFunctionCall(FunctionCallExpr expr) {
            List<CellValue> args = new ArrayList<>(expr.getArgs().size());
            for (Expr arg : expr.getArgs()) {
                if (arg instanceof RangeExpr) {
                    CellValue flattened = readRange((RangeExpr) arg);
                    if (flattened.isError() && flattened.getErrorType() == ErrorType.CIRCULAR_DEPENDENCY) {
                        return flattened;
                    }
                    args.add(flattened);
                } else {
                    args.add(arg.accept(this));
                }
            }
            return functions.call(expr.getName(), args);
        }

        private CellValue readRange(RangeExpr range) {
            if (range.getSheetName() != null && !context.isLocalSheet(range.getSheetName())) {
                return CellValue.error(ErrorType.INVALID_REF, "Unknown sheet: " + range.getSheetName());
            }
            List<CellValue> values = new ArrayList<>();
            for (CellAddress address : range.getRange()) {
                if (context.isEvaluating(address)) {
                    return CellValue.error(CellError.circular(Collections.singletonList(address)));
                }
                values.add(context.getCellValue(address));
            }
            return CellValue.array(values);
        }

        @Override
        public CellValue visitUnaryOp(UnaryOpExpr expr) {
            return Operators.applyUnary(expr.getOperator(), expr.getOperand().accept(this));
        }

        @Override
        public CellValue visitBinaryOp(BinaryOpExpr expr) {
            CellValue left = expr.getLeft().accept(this);
            CellValue right = expr.getRight().accept(this);
            return Operators.applyBinary(expr.getOperator(), left, right);
        }
    }
}

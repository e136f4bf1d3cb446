package com.spreadsheet.engine.formula;

/**
 * Double-dispatch over the expression node types.
 */
public interface ExprVisitor<T> {

    T visitLiteral(LiteralExpr expr);

    T visitReference(ReferenceExpr expr);

    T visitRange(RangeExpr expr);

    T visitFunctionCall(FunctionCallExpr expr);

    T visitUnaryOp(UnaryOpExpr expr);

    T visitBinaryOp(BinaryOpExpr expr);
}

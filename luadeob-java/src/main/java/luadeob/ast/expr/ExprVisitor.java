package luadeob.ast.expr;

public interface ExprVisitor<R> {
    R visitName(Name e);
    R visitNil(NilLiteral e);
    R visitBool(BoolLiteral e);
    R visitNumber(NumberLiteral e);
    R visitString(StringLiteral e);
    R visitVararg(VarargExpr e);
    R visitFunction(FunctionExpr e);
    R visitField(FieldExpr e);
    R visitIndex(IndexExpr e);
    R visitCall(CallExpr e);
    R visitMethodCall(MethodCallExpr e);
    R visitTable(TableExpr e);
    R visitBinary(BinaryExpr e);
    R visitUnary(UnaryExpr e);
    R visitParen(ParenExpr e);
}

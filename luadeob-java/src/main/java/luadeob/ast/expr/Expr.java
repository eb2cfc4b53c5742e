package luadeob.ast.expr;

public sealed interface Expr
        permits Name, NilLiteral, BoolLiteral, NumberLiteral, StringLiteral,
        VarargExpr, FunctionExpr, FieldExpr, IndexExpr,
        CallExpr, MethodCallExpr, TableExpr,
        BinaryExpr, UnaryExpr, ParenExpr {

    <R> R accept(ExprVisitor<R> visitor);
}

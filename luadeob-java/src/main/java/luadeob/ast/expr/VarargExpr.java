package luadeob.ast.expr;

public record VarargExpr() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitVararg(this); }
}

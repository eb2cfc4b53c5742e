package luadeob.ast.expr;

public record IndexExpr(
        Expr target,
        Expr key
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitIndex(this); }
}

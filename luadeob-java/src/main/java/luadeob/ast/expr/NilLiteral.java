package luadeob.ast.expr;

public record NilLiteral() implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitNil(this); }
}

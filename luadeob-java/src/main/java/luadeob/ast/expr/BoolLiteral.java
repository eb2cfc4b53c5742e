package luadeob.ast.expr;

public record BoolLiteral(boolean value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitBool(this); }
}

package luadeob.ast.expr;

/** {@code target.field}; the field is a table key, not an identifier. */
public record FieldExpr(
        Expr target,
        String field
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitField(this); }
}

package luadeob.ast.expr;

/**
 * Explicit parentheses from the source. Kept as a node because
 * {@code (f())} truncates to one value.
 */
public record ParenExpr(Expr inner) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitParen(this); }
}

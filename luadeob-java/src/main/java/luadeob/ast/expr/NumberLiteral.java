package luadeob.ast.expr;

/** Raw source text of the numeral, e.g. {@code 0x1p4} or {@code 1e-3}. */
public record NumberLiteral(String text) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitNumber(this); }
}

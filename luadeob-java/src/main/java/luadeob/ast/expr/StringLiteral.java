package luadeob.ast.expr;

/** Raw source text including quotes or long brackets and escapes. */
public record StringLiteral(String text) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitString(this); }
}

package luadeob.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr expr
) implements Expr {

    public static final int PRIORITY = 12;

    public enum Operator {
        NEG("-"), NOT("not"), LEN("#"), BNOT("~");

        private final String symbol;

        Operator(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitUnary(this); }
}

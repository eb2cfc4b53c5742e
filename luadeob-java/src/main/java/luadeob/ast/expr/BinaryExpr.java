package luadeob.ast.expr;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    /** Symbols with Lua's left and right binding priorities. */
    public enum Operator {
        OR("or", 1, 1), AND("and", 2, 2),
        LT("<", 3, 3), GT(">", 3, 3), LE("<=", 3, 3), GE(">=", 3, 3), NE("~=", 3, 3), EQ("==", 3, 3),
        BOR("|", 4, 4), BXOR("~", 5, 5), BAND("&", 6, 6),
        SHL("<<", 7, 7), SHR(">>", 7, 7),
        CONCAT("..", 9, 8),
        ADD("+", 10, 10), SUB("-", 10, 10),
        MUL("*", 11, 11), DIV("/", 11, 11), IDIV("//", 11, 11), MOD("%", 11, 11),
        POW("^", 14, 13);

        private final String symbol;
        private final int leftPriority;
        private final int rightPriority;

        Operator(String symbol, int leftPriority, int rightPriority) {
            this.symbol = symbol;
            this.leftPriority = leftPriority;
            this.rightPriority = rightPriority;
        }

        public String symbol() { return symbol; }
        public int leftPriority() { return leftPriority; }
        public int rightPriority() { return rightPriority; }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitBinary(this); }
}

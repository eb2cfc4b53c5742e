package luadeob.ast.stmt;

import luadeob.ast.expr.Expr;

/** Luau {@code x += 1} and friends. */
public record CompoundAssignStmt(
        Expr target,
        Operator op,
        Expr value
) implements Stmt {

    public enum Operator {
        ADD("+="), SUB("-="), MUL("*="), DIV("/="), IDIV("//="),
        MOD("%="), POW("^="), CONCAT("..=");

        private final String symbol;

        Operator(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCompoundAssign(this); }
}

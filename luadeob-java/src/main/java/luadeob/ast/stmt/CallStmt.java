package luadeob.ast.stmt;

import luadeob.ast.expr.Expr;

/** A function or method call used as a statement. */
public record CallStmt(Expr call) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitCall(this); }
}

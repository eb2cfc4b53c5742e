package luadeob.ast.stmt;

import luadeob.ast.Block;
import luadeob.ast.expr.Expr;

public record RepeatStmt(
        Block body,
        Expr condition
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRepeat(this); }
}

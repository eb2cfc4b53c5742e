package luadeob.ast.stmt;

import luadeob.ast.Block;
import luadeob.ast.expr.Expr;

public record WhileStmt(
        Expr condition,
        Block body
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhile(this); }
}

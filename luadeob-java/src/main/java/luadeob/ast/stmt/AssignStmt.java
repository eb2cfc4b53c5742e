package luadeob.ast.stmt;

import luadeob.ast.expr.Expr;

import java.util.List;

public record AssignStmt(
        List<Expr> targets,
        List<Expr> values
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssign(this); }
}

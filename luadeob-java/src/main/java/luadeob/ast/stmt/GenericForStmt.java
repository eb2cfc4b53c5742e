package luadeob.ast.stmt;

import luadeob.ast.Block;
import luadeob.ast.expr.Expr;
import luadeob.ast.expr.Name;

import java.util.List;

public record GenericForStmt(
        List<Name> targets,
        List<Expr> iterators,
        Block body
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitGenericFor(this); }
}

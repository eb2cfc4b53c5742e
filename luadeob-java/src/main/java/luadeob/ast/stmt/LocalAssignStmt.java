package luadeob.ast.stmt;

import luadeob.ast.expr.Expr;
import luadeob.ast.expr.Name;

import java.util.List;

/**
 * {@code local a <const>, b = x, y}. {@code attributes} is parallel to
 * {@code targets}; an entry is null when the target has no attribute.
 */
public record LocalAssignStmt(
        List<Name> targets,
        List<String> attributes,
        List<Expr> values
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLocalAssign(this); }
}

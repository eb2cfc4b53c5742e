package luadeob.ast.stmt;

import luadeob.ast.Block;
import luadeob.ast.expr.Expr;
import luadeob.ast.expr.Name;

public record NumericForStmt(
        Name variable,
        Expr start,
        Expr stop,
        Expr step,   // may be null
        Block body
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitNumericFor(this); }
}

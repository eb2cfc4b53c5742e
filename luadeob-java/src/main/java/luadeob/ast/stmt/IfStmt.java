package luadeob.ast.stmt;

import luadeob.ast.Block;
import luadeob.ast.expr.Expr;

import java.util.List;

public record IfStmt(
        List<Branch> branches,   // if + elseif ...
        Block elseBlock          // may be null
) implements Stmt {
    public record Branch(Expr condition, Block body) {}

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIf(this); }
}

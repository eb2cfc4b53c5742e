package luadeob.ast.stmt;

import luadeob.ast.FuncBody;
import luadeob.ast.expr.Name;

public record LocalFunctionStmt(
        Name name,
        FuncBody function
) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLocalFunction(this); }
}

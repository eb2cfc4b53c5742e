package luadeob.ast.stmt;

import luadeob.ast.Block;

public record DoStmt(Block body) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitDo(this); }
}

package luadeob.ast.stmt;

public record GotoStmt(String label) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitGoto(this); }
}

package luadeob.ast.stmt;

public record BreakStmt() implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreak(this); }
}

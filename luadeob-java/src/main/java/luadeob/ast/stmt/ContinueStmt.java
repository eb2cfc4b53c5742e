package luadeob.ast.stmt;

/** Luau {@code continue}. */
public record ContinueStmt() implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinue(this); }
}

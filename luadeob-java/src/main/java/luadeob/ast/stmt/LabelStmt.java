package luadeob.ast.stmt;

/** {@code ::name::} */
public record LabelStmt(String name) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLabel(this); }
}

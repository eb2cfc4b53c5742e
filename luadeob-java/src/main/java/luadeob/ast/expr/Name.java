package luadeob.ast.expr;

import java.util.Objects;

/**
 * An identifier occurrence, either declaring a local or using a variable.
 * The identifier text is the only mutable state in the whole tree.
 */
public final class Name implements Expr {
    private String id;

    public Name(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String id() {
        return id;
    }

    public void rename(String newId) {
        this.id = Objects.requireNonNull(newId, "newId");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitName(this); }

    @Override
    public String toString() {
        return "Name[" + id + "]";
    }
}

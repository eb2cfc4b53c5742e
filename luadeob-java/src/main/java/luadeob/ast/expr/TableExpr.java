package luadeob.ast.expr;

import java.util.List;

/** Table constructor {@code { 1, x = 2, [k] = 3 }}. */
public record TableExpr(List<Entry> entries) implements Expr {

    public sealed interface Entry permits Positional, Named, Keyed {
        Expr value();
    }

    /** {@code value} */
    public record Positional(Expr value) implements Entry {}

    /** {@code name = value}; the name is a string key. */
    public record Named(String name, Expr value) implements Entry {}

    /** {@code [key] = value} */
    public record Keyed(Expr key, Expr value) implements Entry {}

    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitTable(this); }
}

package luadeob.ast.expr;

import java.util.List;

public record CallExpr(
        Expr callee,
        List<Expr> args
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitCall(this); }
}

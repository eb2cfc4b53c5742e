package luadeob.ast.expr;

import java.util.List;

/** {@code receiver:method(args)} */
public record MethodCallExpr(
        Expr receiver,
        String method,
        List<Expr> args
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitMethodCall(this); }
}

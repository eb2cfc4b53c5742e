package luadeob.ast.expr;

import luadeob.ast.FuncBody;

/** Anonymous {@code function(...) end}. */
public record FunctionExpr(FuncBody function) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitFunction(this); }
}

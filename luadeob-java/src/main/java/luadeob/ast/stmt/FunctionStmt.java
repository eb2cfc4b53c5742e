package luadeob.ast.stmt;

import luadeob.ast.FuncBody;
import luadeob.ast.expr.Name;

import java.util.List;

/** {@code function a.b.c:m(...) end} */
public record FunctionStmt(
        FuncName name,
        FuncBody function
) implements Stmt {

    /**
     * Only {@code base} is an identifier; {@code fields} and {@code method}
     * are table keys. {@code method} is null unless declared with ':'.
     */
    public record FuncName(Name base, List<String> fields, String method) {
        public boolean isMethod() { return method != null; }
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunction(this); }
}

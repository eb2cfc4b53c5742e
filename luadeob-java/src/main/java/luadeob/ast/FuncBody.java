package luadeob.ast;

import luadeob.ast.expr.Name;

import java.util.List;

/**
 * Parameter list and body shared by every function form
 * ({@code function f() end}, {@code local function f() end} and
 * anonymous {@code function() end}).
 */
public record FuncBody(
        List<Name> params,
        boolean vararg,
        Block body
) {}

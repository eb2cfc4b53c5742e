package luadeob.ast;

import luadeob.ast.stmt.Stmt;

import java.util.List;

public record Block(List<Stmt> statements) {}

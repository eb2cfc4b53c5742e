package luadeob.ast.stmt;

public sealed interface Stmt
        permits LocalAssignStmt, LocalFunctionStmt, FunctionStmt,
        AssignStmt, CompoundAssignStmt, CallStmt,
        DoStmt, WhileStmt, RepeatStmt, IfStmt,
        NumericForStmt, GenericForStmt,
        ReturnStmt, BreakStmt, ContinueStmt, GotoStmt, LabelStmt {

    <R> R accept(StmtVisitor<R> visitor);
}

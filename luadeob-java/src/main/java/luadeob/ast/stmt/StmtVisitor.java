package luadeob.ast.stmt;

/**
 * One method per statement kind. Adding a kind to {@link Stmt} without a
 * method here does not compile.
 */
public interface StmtVisitor<R> {
    R visitLocalAssign(LocalAssignStmt s);
    R visitLocalFunction(LocalFunctionStmt s);
    R visitFunction(FunctionStmt s);
    R visitAssign(AssignStmt s);
    R visitCompoundAssign(CompoundAssignStmt s);
    R visitCall(CallStmt s);
    R visitDo(DoStmt s);
    R visitWhile(WhileStmt s);
    R visitRepeat(RepeatStmt s);
    R visitIf(IfStmt s);
    R visitNumericFor(NumericForStmt s);
    R visitGenericFor(GenericForStmt s);
    R visitReturn(ReturnStmt s);
    R visitBreak(BreakStmt s);
    R visitContinue(ContinueStmt s);
    R visitGoto(GotoStmt s);
    R visitLabel(LabelStmt s);
}

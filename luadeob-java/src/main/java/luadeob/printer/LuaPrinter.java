package luadeob.printer;

import luadeob.ast.Block;
import luadeob.ast.Chunk;
import luadeob.ast.FuncBody;
import luadeob.ast.expr.*;
import luadeob.ast.stmt.*;

import java.util.List;

/**
 * Serializes a tree back to Lua source, one statement per line with
 * four-space indentation. Grouping is printed only where the source had
 * parentheses ({@link ParenExpr}); the parser already encoded precedence
 * in the tree shape.
 */
public final class LuaPrinter implements StmtVisitor<Void>, ExprVisitor<Void> {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private LuaPrinter() {}

    public static String print(Chunk chunk) {
        LuaPrinter p = new LuaPrinter();
        p.printStatements(chunk.block());
        return p.out.toString();
    }

    // ---------- layout ----------

    private void printStatements(Block block) {
        for (Stmt s : block.statements()) {
            indent();
            int start = out.length();
            s.accept(this);
            // "(f)()" on its own line would otherwise continue the previous statement as a call
            if (start < out.length() && out.charAt(start) == '(') {
                out.insert(start, ';');
            }
            out.append('\n');
        }
    }

    private void printBody(Block block) {
        out.append('\n');
        depth++;
        printStatements(block);
        depth--;
        indent();
    }

    private void indent() {
        for (int i = 0; i < depth; i++) out.append(INDENT);
    }

    private void printFunction(FuncBody f) {
        out.append('(');
        List<Name> params = f.params();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) out.append(", ");
            out.append(params.get(i).id());
        }
        if (f.vararg()) out.append(params.isEmpty() ? "..." : ", ...");
        out.append(')');
        printBody(f.body());
        out.append("end");
    }

    private void printList(List<? extends Expr> exprs) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) out.append(", ");
            exprs.get(i).accept(this);
        }
    }

    // "a[ [[k]] ]": a long string right after '[' would read as a long bracket
    private void printBracketed(Expr key) {
        out.append('[');
        boolean pad = key instanceof StringLiteral s && s.text().startsWith("[");
        if (pad) out.append(' ');
        key.accept(this);
        if (pad) out.append(' ');
        out.append(']');
    }

    // ---------- statements ----------

    @Override
    public Void visitLocalAssign(LocalAssignStmt s) {
        out.append("local ");
        for (int i = 0; i < s.targets().size(); i++) {
            if (i > 0) out.append(", ");
            out.append(s.targets().get(i).id());
            String attrib = s.attributes() == null ? null : s.attributes().get(i);
            if (attrib != null) out.append(" <").append(attrib).append('>');
        }
        if (!s.values().isEmpty()) {
            out.append(" = ");
            printList(s.values());
        }
        return null;
    }

    @Override
    public Void visitLocalFunction(LocalFunctionStmt s) {
        out.append("local function ").append(s.name().id());
        printFunction(s.function());
        return null;
    }

    @Override
    public Void visitFunction(FunctionStmt s) {
        FunctionStmt.FuncName name = s.name();
        out.append("function ").append(name.base().id());
        for (String f : name.fields()) out.append('.').append(f);
        if (name.isMethod()) out.append(':').append(name.method());
        printFunction(s.function());
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt s) {
        printList(s.targets());
        out.append(" = ");
        printList(s.values());
        return null;
    }

    @Override
    public Void visitCompoundAssign(CompoundAssignStmt s) {
        s.target().accept(this);
        out.append(' ').append(s.op().symbol()).append(' ');
        s.value().accept(this);
        return null;
    }

    @Override
    public Void visitCall(CallStmt s) {
        s.call().accept(this);
        return null;
    }

    @Override
    public Void visitDo(DoStmt s) {
        out.append("do");
        printBody(s.body());
        out.append("end");
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt s) {
        out.append("while ");
        s.condition().accept(this);
        out.append(" do");
        printBody(s.body());
        out.append("end");
        return null;
    }

    @Override
    public Void visitRepeat(RepeatStmt s) {
        out.append("repeat");
        printBody(s.body());
        out.append("until ");
        s.condition().accept(this);
        return null;
    }

    @Override
    public Void visitIf(IfStmt s) {
        boolean first = true;
        for (IfStmt.Branch b : s.branches()) {
            out.append(first ? "if " : "elseif ");
            first = false;
            b.condition().accept(this);
            out.append(" then");
            printBody(b.body());
        }
        if (s.elseBlock() != null) {
            out.append("else");
            printBody(s.elseBlock());
        }
        out.append("end");
        return null;
    }

    @Override
    public Void visitNumericFor(NumericForStmt s) {
        out.append("for ").append(s.variable().id()).append(" = ");
        s.start().accept(this);
        out.append(", ");
        s.stop().accept(this);
        if (s.step() != null) {
            out.append(", ");
            s.step().accept(this);
        }
        out.append(" do");
        printBody(s.body());
        out.append("end");
        return null;
    }

    @Override
    public Void visitGenericFor(GenericForStmt s) {
        out.append("for ");
        printList(s.targets());
        out.append(" in ");
        printList(s.iterators());
        out.append(" do");
        printBody(s.body());
        out.append("end");
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt s) {
        out.append("return");
        if (!s.values().isEmpty()) {
            out.append(' ');
            printList(s.values());
        }
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt s) {
        out.append("break");
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt s) {
        out.append("continue");
        return null;
    }

    @Override
    public Void visitGoto(GotoStmt s) {
        out.append("goto ").append(s.label());
        return null;
    }

    @Override
    public Void visitLabel(LabelStmt s) {
        out.append("::").append(s.name()).append("::");
        return null;
    }

    // ---------- expressions ----------

    @Override
    public Void visitName(Name e) {
        out.append(e.id());
        return null;
    }

    @Override
    public Void visitNil(NilLiteral e) {
        out.append("nil");
        return null;
    }

    @Override
    public Void visitBool(BoolLiteral e) {
        out.append(e.value());
        return null;
    }

    @Override
    public Void visitNumber(NumberLiteral e) {
        out.append(e.text());
        return null;
    }

    @Override
    public Void visitString(StringLiteral e) {
        out.append(e.text());
        return null;
    }

    @Override
    public Void visitVararg(VarargExpr e) {
        out.append("...");
        return null;
    }

    @Override
    public Void visitFunction(FunctionExpr e) {
        out.append("function");
        printFunction(e.function());
        return null;
    }

    @Override
    public Void visitField(FieldExpr e) {
        e.target().accept(this);
        out.append('.').append(e.field());
        return null;
    }

    @Override
    public Void visitIndex(IndexExpr e) {
        e.target().accept(this);
        printBracketed(e.key());
        return null;
    }

    @Override
    public Void visitCall(CallExpr e) {
        e.callee().accept(this);
        out.append('(');
        printList(e.args());
        out.append(')');
        return null;
    }

    @Override
    public Void visitMethodCall(MethodCallExpr e) {
        e.receiver().accept(this);
        out.append(':').append(e.method()).append('(');
        printList(e.args());
        out.append(')');
        return null;
    }

    @Override
    public Void visitTable(TableExpr e) {
        out.append('{');
        List<TableExpr.Entry> entries = e.entries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) out.append(", ");
            TableExpr.Entry entry = entries.get(i);
            if (entry instanceof TableExpr.Named named) {
                out.append(named.name()).append(" = ");
            } else if (entry instanceof TableExpr.Keyed keyed) {
                printBracketed(keyed.key());
                out.append(" = ");
            }
            entry.value().accept(this);
        }
        out.append('}');
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        e.left().accept(this);
        out.append(' ').append(e.op().symbol()).append(' ');
        e.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        out.append(e.op().symbol());
        if (e.op() == UnaryExpr.Operator.NOT
                || (e.op() == UnaryExpr.Operator.NEG && startsWithMinus(e.expr()))) {
            // "not x", and "- -x" which would otherwise start a comment
            out.append(' ');
        }
        e.expr().accept(this);
        return null;
    }

    @Override
    public Void visitParen(ParenExpr e) {
        out.append('(');
        e.inner().accept(this);
        out.append(')');
        return null;
    }

    private static boolean startsWithMinus(Expr e) {
        if (e instanceof UnaryExpr u) return u.op() == UnaryExpr.Operator.NEG;
        if (e instanceof BinaryExpr b) return startsWithMinus(b.left());
        return false;
    }
}

package luadeob.rename;

import luadeob.ast.Block;
import luadeob.ast.Chunk;
import luadeob.ast.FuncBody;
import luadeob.ast.expr.*;
import luadeob.ast.stmt.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Rewrites every local declaration and every use bound to it with a fresh
 * name, following Lua's scoping rules. One instance serves exactly one
 * run; the tree is changed in place and only at {@link Name} nodes.
 *
 * <p>On {@link StructuralException} the tree is partially renamed and
 * must be thrown away.
 */
public final class Renamer implements StmtVisitor<Void>, ExprVisitor<Void> {
    private static final Logger logger = LoggerFactory.getLogger(Renamer.class);

    // names the runtime itself reads: a local _ENV is where globals are looked up
    private static final Set<String> KEPT_NAMES = Set.of("_ENV");

    private final ScopeStack scopes;
    private boolean used = false;
    private int declarations = 0;
    private int rewrites = 0;
    private int unresolved = 0;

    public Renamer(NameGenerator names) {
        this.scopes = new ScopeStack(names);
    }

    public Chunk traverse(Chunk chunk) {
        if (used) throw new IllegalStateException("Renamer instances are single-use");
        used = true;

        require(chunk, "chunk");
        visitScoped(require(chunk.block(), "chunk block"));

        if (scopes.depth() != 0) {
            throw new StructuralException("Unbalanced scopes after traversal: depth " + scopes.depth());
        }
        logger.info("Renamed {} declarations, rewrote {} uses, left {} global references", declarations, rewrites, unresolved);
        return chunk;
    }

    public int declarations() { return declarations; }
    public int rewrites() { return rewrites; }

    // ---------- scopes ----------

    // a block that opens its own scope: the chunk and 'do ... end'
    private void visitScoped(Block block) {
        scopes.push();
        visitStatements(block);
        scopes.pop();
    }

    // statements of a body whose scope the caller already opened
    private void visitStatements(Block block) {
        require(block, "block");
        for (Stmt s : require(block.statements(), "block statements")) {
            require(s, "statement").accept(this);
        }
    }

    private void visitFunction(FuncBody f, boolean method) {
        require(f, "function body");
        scopes.push();
        if (method) keep("self");
        for (Name p : require(f.params(), "parameter list")) {
            declare(p);
        }
        visitStatements(require(f.body(), "function body block"));
        scopes.pop();
    }

    private void declare(Name name) {
        require(name, "declared name");
        String old = name.id();
        declarations++;
        if (KEPT_NAMES.contains(old)) {
            keep(old);
            return;
        }
        String fresh = scopes.declare(old);
        name.rename(fresh);
        logger.debug("declare {} -> {} at depth {}", old, fresh, scopes.depth());
    }

    // shadows the name in the current scope without renaming it
    private void keep(String name) {
        scopes.bindUnchanged(name);
        logger.debug("keep {} at depth {}", name, scopes.depth());
    }

    private void visitAll(List<? extends Expr> exprs) {
        for (Expr e : require(exprs, "expression list")) visit(e);
    }

    private void visit(Expr e) {
        require(e, "expression").accept(this);
    }

    // ---------- statements ----------

    @Override
    public Void visitLocalAssign(LocalAssignStmt s) {
        List<Name> targets = require(s.targets(), "local targets");
        if (targets.isEmpty()) throw new StructuralException("local statement without targets");
        if (s.attributes() != null && s.attributes().size() != targets.size()) {
            throw new StructuralException("local statement has " + targets.size()
                    + " targets but " + s.attributes().size() + " attributes");
        }

        // values see the scope as it was before this statement: local x = x
        visitAll(s.values());
        for (Name t : targets) declare(t);
        return null;
    }

    @Override
    public Void visitLocalFunction(LocalFunctionStmt s) {
        // bound before the body so the function can call itself
        declare(s.name());
        visitFunction(s.function(), false);
        return null;
    }

    @Override
    public Void visitFunction(FunctionStmt s) {
        FunctionStmt.FuncName name = require(s.name(), "function name");
        visit(require(name.base(), "function base name"));
        visitFunction(s.function(), name.isMethod());
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt s) {
        if (require(s.targets(), "assignment targets").isEmpty()) {
            throw new StructuralException("assignment without targets");
        }
        visitAll(s.targets());
        visitAll(s.values());
        return null;
    }

    @Override
    public Void visitCompoundAssign(CompoundAssignStmt s) {
        require(s.op(), "compound operator");
        visit(s.target());
        visit(s.value());
        return null;
    }

    @Override
    public Void visitCall(CallStmt s) {
        visit(s.call());
        return null;
    }

    @Override
    public Void visitDo(DoStmt s) {
        visitScoped(require(s.body(), "do body"));
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt s) {
        visit(s.condition());
        scopes.push();
        visitStatements(s.body());
        scopes.pop();
        return null;
    }

    @Override
    public Void visitRepeat(RepeatStmt s) {
        scopes.push();
        visitStatements(s.body());
        // the condition sees locals of the body
        visit(s.condition());
        scopes.pop();
        return null;
    }

    @Override
    public Void visitIf(IfStmt s) {
        List<IfStmt.Branch> branches = require(s.branches(), "if branches");
        if (branches.isEmpty()) throw new StructuralException("if statement without branches");

        for (IfStmt.Branch b : branches) {
            require(b, "if branch");
            visit(b.condition());
            scopes.push();
            visitStatements(b.body());
            scopes.pop();
        }
        if (s.elseBlock() != null) {
            scopes.push();
            visitStatements(s.elseBlock());
            scopes.pop();
        }
        return null;
    }

    @Override
    public Void visitNumericFor(NumericForStmt s) {
        visit(s.start());
        visit(s.stop());
        if (s.step() != null) visit(s.step());

        scopes.push();
        declare(s.variable());
        visitStatements(s.body());
        scopes.pop();
        return null;
    }

    @Override
    public Void visitGenericFor(GenericForStmt s) {
        List<Name> targets = require(s.targets(), "for targets");
        if (targets.isEmpty()) throw new StructuralException("generic for without targets");
        if (require(s.iterators(), "for iterators").isEmpty()) {
            throw new StructuralException("generic for without iterator expressions");
        }

        visitAll(s.iterators());
        scopes.push();
        for (Name t : targets) declare(t);
        visitStatements(s.body());
        scopes.pop();
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt s) {
        visitAll(s.values());
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt s) { return null; }

    @Override
    public Void visitContinue(ContinueStmt s) { return null; }

    // labels live in their own namespace
    @Override
    public Void visitGoto(GotoStmt s) { return null; }

    @Override
    public Void visitLabel(LabelStmt s) { return null; }

    // ---------- expressions ----------

    @Override
    public Void visitName(Name e) {
        Resolution r = scopes.resolve(e.id());
        if (r instanceof Resolution.Found found) {
            if (!found.freshName().equals(e.id())) {
                logger.debug("use {} -> {} bound at depth {}", e.id(), found.freshName(), found.depth());
                e.rename(found.freshName());
                rewrites++;
            }
        } else {
            unresolved++;
        }
        return null;
    }

    @Override
    public Void visitNil(NilLiteral e) { return null; }

    @Override
    public Void visitBool(BoolLiteral e) { return null; }

    @Override
    public Void visitNumber(NumberLiteral e) { return null; }

    @Override
    public Void visitString(StringLiteral e) { return null; }

    @Override
    public Void visitVararg(VarargExpr e) { return null; }

    @Override
    public Void visitFunction(FunctionExpr e) {
        visitFunction(e.function(), false);
        return null;
    }

    @Override
    public Void visitField(FieldExpr e) {
        visit(e.target());
        return null;
    }

    @Override
    public Void visitIndex(IndexExpr e) {
        visit(e.target());
        visit(e.key());
        return null;
    }

    @Override
    public Void visitCall(CallExpr e) {
        visit(e.callee());
        visitAll(e.args());
        return null;
    }

    @Override
    public Void visitMethodCall(MethodCallExpr e) {
        visit(e.receiver());
        visitAll(e.args());
        return null;
    }

    @Override
    public Void visitTable(TableExpr e) {
        for (TableExpr.Entry entry : require(e.entries(), "table entries")) {
            if (entry instanceof TableExpr.Keyed keyed) visit(keyed.key());
            visit(require(entry, "table entry").value());
        }
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr e) {
        require(e.op(), "binary operator");
        visit(e.left());
        visit(e.right());
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr e) {
        require(e.op(), "unary operator");
        visit(e.expr());
        return null;
    }

    @Override
    public Void visitParen(ParenExpr e) {
        visit(e.inner());
        return null;
    }

    private static <T> T require(T node, String what) {
        if (node == null) throw new StructuralException("Malformed tree: missing " + what);
        return node;
    }
}

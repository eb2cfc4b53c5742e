package luadeob.parser;

import luadeob.ast.Block;
import luadeob.ast.Chunk;
import luadeob.ast.FuncBody;
import luadeob.ast.expr.*;
import luadeob.ast.stmt.AssignStmt;
import luadeob.ast.stmt.BreakStmt;
import luadeob.ast.stmt.CallStmt;
import luadeob.ast.stmt.CompoundAssignStmt;
import luadeob.ast.stmt.ContinueStmt;
import luadeob.ast.stmt.DoStmt;
import luadeob.ast.stmt.FunctionStmt;
import luadeob.ast.stmt.GenericForStmt;
import luadeob.ast.stmt.GotoStmt;
import luadeob.ast.stmt.IfStmt;
import luadeob.ast.stmt.LabelStmt;
import luadeob.ast.stmt.LocalAssignStmt;
import luadeob.ast.stmt.LocalFunctionStmt;
import luadeob.ast.stmt.NumericForStmt;
import luadeob.ast.stmt.RepeatStmt;
import luadeob.ast.stmt.ReturnStmt;
import luadeob.ast.stmt.Stmt;
import luadeob.ast.stmt.WhileStmt;
import luadeob.lexer.Token;
import luadeob.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for Lua 5.4 with the Luau additions
 * {@code continue} and compound assignment.
 */
public final class Parser {
    private static final Set<TokenType> BLOCK_END = EnumSet.of(
            TokenType.EOF, TokenType.END, TokenType.ELSE, TokenType.ELSEIF, TokenType.UNTIL);

    // tokens that make a leading 'continue' part of an expression statement
    private static final Set<TokenType> CONTINUE_AS_NAME = EnumSet.of(
            TokenType.LPAREN, TokenType.ASSIGN, TokenType.DOT, TokenType.LBRACKET,
            TokenType.COLON, TokenType.COMMA, TokenType.STRING, TokenType.LBRACE,
            TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.STAR_ASSIGN,
            TokenType.SLASH_ASSIGN, TokenType.DSLASH_ASSIGN, TokenType.PERCENT_ASSIGN,
            TokenType.CARET_ASSIGN, TokenType.CONCAT_ASSIGN);

    // same bound as Lua's LUAI_MAXCCALLS; also caps the tree depth later passes recurse over
    static final int MAX_NESTING = 200;

    private final List<Token> tokens;
    private int pos = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Chunk parseChunk() {
        Block block = parseBlock();
        consume(TokenType.EOF, "Expected <eof>");
        return new Chunk(block);
    }

    // ---------- block / statements ----------
    private Block parseBlock() {
        List<Stmt> stmts = new ArrayList<>();
        while (!BLOCK_END.contains(peek().type())) {
            if (match(TokenType.SEMICOLON)) continue;
            if (match(TokenType.RETURN)) {
                stmts.add(parseReturn());
                break;
            }
            stmts.add(parseStmt());
        }
        return new Block(stmts);
    }

    private Stmt parseStmt() {
        int saved = nest();
        Stmt s = parseStmtBody();
        depth = saved;
        return s;
    }

    private Stmt parseStmtBody() {
        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.WHILE)) return parseWhile();
        if (match(TokenType.DO)) {
            Block body = parseBlock();
            consume(TokenType.END, "Expected 'end' to close 'do'");
            return new DoStmt(body);
        }
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.REPEAT)) return parseRepeat();
        if (match(TokenType.FUNCTION)) return parseFunctionStmt();
        if (match(TokenType.LOCAL)) {
            if (match(TokenType.FUNCTION)) {
                Name name = parseName("Expected function name");
                return new LocalFunctionStmt(name, parseFuncBody());
            }
            return parseLocal();
        }
        if (match(TokenType.DCOLON)) {
            Token label = consume(TokenType.NAME, "Expected label name");
            consume(TokenType.DCOLON, "Expected '::' after label name");
            return new LabelStmt(label.lexeme());
        }
        if (match(TokenType.BREAK)) return new BreakStmt();
        if (match(TokenType.GOTO)) {
            return new GotoStmt(consume(TokenType.NAME, "Expected label after 'goto'").lexeme());
        }
        if (check(TokenType.NAME) && peek().lexeme().equals("continue")
                && !CONTINUE_AS_NAME.contains(peekNext().type())) {
            advance();
            return new ContinueStmt();
        }
        return parseExprStmt();
    }

    private IfStmt parseIf() {
        List<IfStmt.Branch> branches = new ArrayList<>();
        branches.add(parseBranch());

        Block elseB = null;
        while (true) {
            if (match(TokenType.ELSEIF)) {
                branches.add(parseBranch());
            } else if (match(TokenType.ELSE)) {
                elseB = parseBlock();
                consume(TokenType.END, "Expected 'end' to close 'if'");
                break;
            } else {
                consume(TokenType.END, "Expected 'end' to close 'if'");
                break;
            }
        }
        return new IfStmt(branches, elseB);
    }

    private IfStmt.Branch parseBranch() {
        Expr cond = parseExpr();
        consume(TokenType.THEN, "Expected 'then'");
        return new IfStmt.Branch(cond, parseBlock());
    }

    private WhileStmt parseWhile() {
        Expr cond = parseExpr();
        consume(TokenType.DO, "Expected 'do' after while condition");
        Block body = parseBlock();
        consume(TokenType.END, "Expected 'end' to close 'while'");
        return new WhileStmt(cond, body);
    }

    private RepeatStmt parseRepeat() {
        Block body = parseBlock();
        consume(TokenType.UNTIL, "Expected 'until' to close 'repeat'");
        return new RepeatStmt(body, parseExpr());
    }

    private Stmt parseFor() {
        Name first = parseName("Expected loop variable");

        // numeric: for i = a, b [, c] do ... end
        if (match(TokenType.ASSIGN)) {
            Expr start = parseExpr();
            consume(TokenType.COMMA, "Expected ',' in numeric for");
            Expr stop = parseExpr();
            Expr step = match(TokenType.COMMA) ? parseExpr() : null;
            consume(TokenType.DO, "Expected 'do' in for");
            Block body = parseBlock();
            consume(TokenType.END, "Expected 'end' to close 'for'");
            return new NumericForStmt(first, start, stop, step, body);
        }

        // generic: for k, v in explist do ... end
        List<Name> targets = new ArrayList<>();
        targets.add(first);
        while (match(TokenType.COMMA)) {
            targets.add(parseName("Expected loop variable"));
        }
        consume(TokenType.IN, "Expected '=' or 'in' in for");
        List<Expr> iterators = parseExprList();
        consume(TokenType.DO, "Expected 'do' in for");
        Block body = parseBlock();
        consume(TokenType.END, "Expected 'end' to close 'for'");
        return new GenericForStmt(targets, iterators, body);
    }

    private FunctionStmt parseFunctionStmt() {
        Name base = parseName("Expected function name");
        List<String> fields = new ArrayList<>();
        while (match(TokenType.DOT)) {
            fields.add(consume(TokenType.NAME, "Expected name after '.'").lexeme());
        }
        String method = null;
        if (match(TokenType.COLON)) {
            method = consume(TokenType.NAME, "Expected method name after ':'").lexeme();
        }
        return new FunctionStmt(new FunctionStmt.FuncName(base, fields, method), parseFuncBody());
    }

    private LocalAssignStmt parseLocal() {
        List<Name> targets = new ArrayList<>();
        List<String> attribs = new ArrayList<>();
        do {
            targets.add(parseName("Expected local name"));
            String attrib = null;
            if (match(TokenType.LT)) {
                attrib = consume(TokenType.NAME, "Expected attribute name").lexeme();
                consume(TokenType.GT, "Expected '>' after attribute");
            }
            attribs.add(attrib);
        } while (match(TokenType.COMMA));

        List<Expr> values = match(TokenType.ASSIGN) ? parseExprList() : List.of();
        return new LocalAssignStmt(targets, attribs, values);
    }

    private ReturnStmt parseReturn() {
        List<Expr> values = (BLOCK_END.contains(peek().type()) || check(TokenType.SEMICOLON))
                ? List.of()
                : parseExprList();
        match(TokenType.SEMICOLON);
        if (!BLOCK_END.contains(peek().type())) {
            throw error(peek(), "'return' must be the last statement of a block");
        }
        return new ReturnStmt(values);
    }

    private Stmt parseExprStmt() {
        Token start = peek();
        Expr e = parseSuffixedExpr();

        if (check(TokenType.ASSIGN) || check(TokenType.COMMA)) {
            List<Expr> targets = new ArrayList<>();
            targets.add(requireAssignable(e, start));
            while (match(TokenType.COMMA)) {
                Token at = peek();
                targets.add(requireAssignable(parseSuffixedExpr(), at));
            }
            consume(TokenType.ASSIGN, "Expected '=' in assignment");
            return new AssignStmt(targets, parseExprList());
        }

        CompoundAssignStmt.Operator op = toCompoundOp(peek().type());
        if (op != null) {
            advance();
            return new CompoundAssignStmt(requireAssignable(e, start), op, parseExpr());
        }

        if (!(e instanceof CallExpr || e instanceof MethodCallExpr)) {
            throw error(start, "Syntax error: expression is not a statement");
        }
        return new CallStmt(e);
    }

    private Expr requireAssignable(Expr e, Token at) {
        if (!(e instanceof Name || e instanceof FieldExpr || e instanceof IndexExpr)) {
            throw error(at, "Invalid assignment target");
        }
        return e;
    }

    // ---------- functions ----------
    private FuncBody parseFuncBody() {
        consume(TokenType.LPAREN, "Expected '(' before parameters");
        List<Name> params = new ArrayList<>();
        boolean vararg = false;
        if (!check(TokenType.RPAREN)) {
            do {
                if (match(TokenType.DOTS)) {
                    vararg = true;
                    break;
                }
                params.add(parseName("Expected parameter name"));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        Block body = parseBlock();
        consume(TokenType.END, "Expected 'end' to close function");
        return new FuncBody(params, vararg, body);
    }

    // ---------- expressions (Lua priority climbing) ----------
    private Expr parseExpr() { return parseSubExpr(0); }

    private List<Expr> parseExprList() {
        List<Expr> list = new ArrayList<>();
        do { list.add(parseExpr()); } while (match(TokenType.COMMA));
        return list;
    }

    private Expr parseSubExpr(int limit) {
        int saved = nest();
        Expr e;
        UnaryExpr.Operator uop = toUnaryOp(peek().type());
        if (uop != null) {
            advance();
            e = new UnaryExpr(uop, parseSubExpr(UnaryExpr.PRIORITY));
        } else {
            e = parseSimpleExpr();
        }

        BinaryExpr.Operator op = toBinOp(peek().type());
        while (op != null && op.leftPriority() > limit) {
            advance();
            Expr r = parseSubExpr(op.rightPriority());
            e = new BinaryExpr(e, op, r);
            nest();
            op = toBinOp(peek().type());
        }
        depth = saved;
        return e;
    }

    private Expr parseSimpleExpr() {
        if (match(TokenType.NUMBER)) return new NumberLiteral(previous().lexeme());
        if (match(TokenType.STRING)) return new StringLiteral(previous().lexeme());
        if (match(TokenType.NIL)) return new NilLiteral();
        if (match(TokenType.TRUE)) return new BoolLiteral(true);
        if (match(TokenType.FALSE)) return new BoolLiteral(false);
        if (match(TokenType.DOTS)) return new VarargExpr();
        if (check(TokenType.LBRACE)) return parseTable();
        if (match(TokenType.FUNCTION)) return new FunctionExpr(parseFuncBody());
        return parseSuffixedExpr();
    }

    private Expr parsePrimaryExpr() {
        if (check(TokenType.NAME)) return new Name(advance().lexeme());
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return new ParenExpr(e);
        }
        throw error(peek(), "Unexpected symbol");
    }

    private Expr parseSuffixedExpr() {
        int saved = depth;
        Expr e = parsePrimaryExpr();
        while (true) {
            if (check(TokenType.DOT) || check(TokenType.LBRACKET) || check(TokenType.COLON)
                    || check(TokenType.LPAREN) || check(TokenType.LBRACE) || check(TokenType.STRING)) {
                nest();
            }
            if (match(TokenType.DOT)) {
                Token name = consume(TokenType.NAME, "Expected field name after '.'");
                e = new FieldExpr(e, name.lexeme());
                continue;
            }
            if (match(TokenType.LBRACKET)) {
                Expr key = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']'");
                e = new IndexExpr(e, key);
                continue;
            }
            if (match(TokenType.COLON)) {
                Token name = consume(TokenType.NAME, "Expected method name after ':'");
                e = new MethodCallExpr(e, name.lexeme(), parseArgs());
                continue;
            }
            if (check(TokenType.LPAREN) || check(TokenType.LBRACE) || check(TokenType.STRING)) {
                e = new CallExpr(e, parseArgs());
                continue;
            }
            break;
        }
        depth = saved;
        return e;
    }

    private List<Expr> parseArgs() {
        if (match(TokenType.STRING)) return List.of(new StringLiteral(previous().lexeme()));
        if (check(TokenType.LBRACE)) return List.of(parseTable());

        consume(TokenType.LPAREN, "Expected function arguments");
        List<Expr> args = check(TokenType.RPAREN) ? List.of() : parseExprList();
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return args;
    }

    private TableExpr parseTable() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<TableExpr.Entry> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (match(TokenType.LBRACKET)) {
                Expr key = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']' after table key");
                consume(TokenType.ASSIGN, "Expected '=' after table key");
                entries.add(new TableExpr.Keyed(key, parseExpr()));
            } else if (check(TokenType.NAME) && checkNext(TokenType.ASSIGN)) {
                String name = advance().lexeme();
                advance(); // '='
                entries.add(new TableExpr.Named(name, parseExpr()));
            } else {
                entries.add(new TableExpr.Positional(parseExpr()));
            }
            if (!match(TokenType.COMMA) && !match(TokenType.SEMICOLON)) break;
        }
        consume(TokenType.RBRACE, "Expected '}' to close table");
        return new TableExpr(entries);
    }

    // ---------- helpers ----------
    private Name parseName(String msg) {
        return new Name(consume(TokenType.NAME, msg).lexeme());
    }

    private boolean match(TokenType t) {
        if (check(t)) { advance(); return true; }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        return peekNext().type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token peekNext() { return tokens.get(Math.min(pos + 1, tokens.size() - 1)); }
    private Token previous() { return tokens.get(pos - 1); }

    // enters one nesting level and returns the depth to restore on the way out
    private int nest() {
        int saved = depth;
        if (++depth > MAX_NESTING) {
            throw error(peek(), "Nesting deeper than " + MAX_NESTING + " levels");
        }
        return saved;
    }

    private ParseException error(Token at, String msg) {
        return new ParseException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
    }

    private static UnaryExpr.Operator toUnaryOp(TokenType t) {
        return switch (t) {
            case MINUS -> UnaryExpr.Operator.NEG;
            case NOT   -> UnaryExpr.Operator.NOT;
            case HASH  -> UnaryExpr.Operator.LEN;
            case TILDE -> UnaryExpr.Operator.BNOT;
            default -> null;
        };
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case OR  -> BinaryExpr.Operator.OR;
            case AND -> BinaryExpr.Operator.AND;

            case LT -> BinaryExpr.Operator.LT;
            case GT -> BinaryExpr.Operator.GT;
            case LE -> BinaryExpr.Operator.LE;
            case GE -> BinaryExpr.Operator.GE;
            case NE -> BinaryExpr.Operator.NE;
            case EQ -> BinaryExpr.Operator.EQ;

            case PIPE  -> BinaryExpr.Operator.BOR;
            case TILDE -> BinaryExpr.Operator.BXOR;
            case AMP   -> BinaryExpr.Operator.BAND;
            case SHL   -> BinaryExpr.Operator.SHL;
            case SHR   -> BinaryExpr.Operator.SHR;

            case CONCAT -> BinaryExpr.Operator.CONCAT;

            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case DSLASH  -> BinaryExpr.Operator.IDIV;
            case PERCENT -> BinaryExpr.Operator.MOD;
            case CARET   -> BinaryExpr.Operator.POW;

            default -> null;
        };
    }

    private static CompoundAssignStmt.Operator toCompoundOp(TokenType t) {
        return switch (t) {
            case PLUS_ASSIGN    -> CompoundAssignStmt.Operator.ADD;
            case MINUS_ASSIGN   -> CompoundAssignStmt.Operator.SUB;
            case STAR_ASSIGN    -> CompoundAssignStmt.Operator.MUL;
            case SLASH_ASSIGN   -> CompoundAssignStmt.Operator.DIV;
            case DSLASH_ASSIGN  -> CompoundAssignStmt.Operator.IDIV;
            case PERCENT_ASSIGN -> CompoundAssignStmt.Operator.MOD;
            case CARET_ASSIGN   -> CompoundAssignStmt.Operator.POW;
            case CONCAT_ASSIGN  -> CompoundAssignStmt.Operator.CONCAT;
            default -> null;
        };
    }
}

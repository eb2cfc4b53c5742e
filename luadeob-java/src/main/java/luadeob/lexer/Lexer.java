package luadeob.lexer;

import java.util.*;

/**
 * Turns Lua 5.4 / Luau source into tokens. Comments and a leading
 * {@code #} line are dropped here, so later stages never see them.
 * Lexemes keep their raw source text, quotes and escapes included.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("break", TokenType.BREAK),
            Map.entry("do", TokenType.DO),
            Map.entry("else", TokenType.ELSE),
            Map.entry("elseif", TokenType.ELSEIF),
            Map.entry("end", TokenType.END),
            Map.entry("false", TokenType.FALSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("goto", TokenType.GOTO),
            Map.entry("if", TokenType.IF),
            Map.entry("in", TokenType.IN),
            Map.entry("local", TokenType.LOCAL),
            Map.entry("nil", TokenType.NIL),
            Map.entry("not", TokenType.NOT),
            Map.entry("or", TokenType.OR),
            Map.entry("repeat", TokenType.REPEAT),
            Map.entry("return", TokenType.RETURN),
            Map.entry("then", TokenType.THEN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("while", TokenType.WHILE)
    );

    public Lexer(String source) {
        this.source = source;
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> tokenize() {
        skipShebang();

        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '+' -> opOrAssign(TokenType.PLUS, TokenType.PLUS_ASSIGN, "+", startLine, startCol);
                case '*' -> opOrAssign(TokenType.STAR, TokenType.STAR_ASSIGN, "*", startLine, startCol);
                case '%' -> opOrAssign(TokenType.PERCENT, TokenType.PERCENT_ASSIGN, "%", startLine, startCol);
                case '^' -> opOrAssign(TokenType.CARET, TokenType.CARET_ASSIGN, "^", startLine, startCol);

                case '-' -> {
                    if (match('-')) {
                        skipComment();
                    } else {
                        opOrAssign(TokenType.MINUS, TokenType.MINUS_ASSIGN, "-", startLine, startCol);
                    }
                }

                case '/' -> {
                    if (match('/')) {
                        opOrAssign(TokenType.DSLASH, TokenType.DSLASH_ASSIGN, "//", startLine, startCol);
                    } else {
                        opOrAssign(TokenType.SLASH, TokenType.SLASH_ASSIGN, "/", startLine, startCol);
                    }
                }

                case '=' -> {
                    boolean eq = match('=');
                    add(eq ? TokenType.EQ : TokenType.ASSIGN, eq ? "==" : "=", startLine, startCol);
                }
                case '~' -> {
                    boolean ne = match('=');
                    add(ne ? TokenType.NE : TokenType.TILDE, ne ? "~=" : "~", startLine, startCol);
                }
                case '<' -> {
                    if (match('<')) add(TokenType.SHL, "<<", startLine, startCol);
                    else if (match('=')) add(TokenType.LE, "<=", startLine, startCol);
                    else add(TokenType.LT, "<", startLine, startCol);
                }
                case '>' -> {
                    if (match('>')) add(TokenType.SHR, ">>", startLine, startCol);
                    else if (match('=')) add(TokenType.GE, ">=", startLine, startCol);
                    else add(TokenType.GT, ">", startLine, startCol);
                }
                case ':' -> {
                    boolean dc = match(':');
                    add(dc ? TokenType.DCOLON : TokenType.COLON, dc ? "::" : ":", startLine, startCol);
                }

                case '.' -> {
                    if (match('.')) {
                        if (match('.')) add(TokenType.DOTS, "...", startLine, startCol);
                        else if (match('=')) add(TokenType.CONCAT_ASSIGN, "..=", startLine, startCol);
                        else add(TokenType.CONCAT, "..", startLine, startCol);
                    } else if (isDigit(peek())) {
                        numberLiteral(startLine, startCol);
                    } else {
                        add(TokenType.DOT, ".", startLine, startCol);
                    }
                }

                case '[' -> {
                    int level = longBracketLevel();
                    if (level >= 0) {
                        String body = longBracket(level, "string");
                        add(TokenType.STRING, "[" + body, startLine, startCol);
                    } else {
                        add(TokenType.LBRACKET, "[", startLine, startCol);
                    }
                }

                case '#' -> add(TokenType.HASH, "#", startLine, startCol);
                case '&' -> add(TokenType.AMP, "&", startLine, startCol);
                case '|' -> add(TokenType.PIPE, "|", startLine, startCol);
                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);

                case '"', '\'' -> stringLiteral(c, startLine, startCol);

                default -> {
                    if (isDigit(c)) numberLiteral(startLine, startCol);
                    else if (isAlpha(c)) identifier(startLine, startCol);
                    else error("Unexpected character: " + c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    // the first character is already consumed; pos - 1 is where the number starts
    private void numberLiteral(int line, int col) {
        int start = pos - 1;
        char first = source.charAt(start);

        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            consumeDigits(true);
            if (peek() == '.') {
                advance();
                consumeDigits(true);
            }
            if (peek() == 'p' || peek() == 'P') exponent();
        } else if (first == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            consumeDigits(false);
        } else {
            consumeDigits(false);
            if (first != '.' && peek() == '.' && peekNext() != '.') {
                advance();
                consumeDigits(false);
            }
            if (peek() == 'e' || peek() == 'E') exponent();
        }

        if (isAlpha(peek())) error("Malformed number near '" + source.substring(start, pos + 1) + "'");
        add(TokenType.NUMBER, source.substring(start, pos), line, col);
    }

    private void consumeDigits(boolean hex) {
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_' || (hex && isHexLetter(peek())))) {
            advance();
        }
    }

    private void exponent() {
        advance();
        if (peek() == '+' || peek() == '-') advance();
        if (!isDigit(peek())) error("Malformed number exponent");
        consumeDigits(false);
    }

    private void identifier(int line, int col) {
        int start = pos - 1;
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            advance();
        }

        String text = source.substring(start, pos);
        TokenType type = keywords.getOrDefault(text, TokenType.NAME);

        add(type, text, line, col);
    }

    private void stringLiteral(char quote, int line, int col) {
        int start = pos - 1;

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') error("Unterminated string");
            if (c == '\\') {
                if (isAtEnd()) break;
                advance();
            }
        }

        if (isAtEnd()) error("Unterminated string");

        advance(); // closing quote
        add(TokenType.STRING, source.substring(start, pos), line, col);
    }

    /**
     * With the opening '[' consumed, returns the number of '=' in a long
     * bracket opener such as {@code [==[}, or -1 if this is not one.
     * Consumes the opener only when it matches.
     */
    private int longBracketLevel() {
        int p = pos;
        int level = 0;
        while (p < source.length() && source.charAt(p) == '=') {
            level++;
            p++;
        }
        if (p < source.length() && source.charAt(p) == '[') {
            while (pos <= p) advance();
            return level;
        }
        return -1;
    }

    // returns the raw text after the first '[' up to and including the closer
    private String longBracket(int level, String what) {
        int start = pos - level - 1;
        String closer = "]" + "=".repeat(level) + "]";
        int end = source.indexOf(closer, pos);
        if (end < 0) error("Unfinished long " + what);
        while (pos < end + closer.length()) advance();
        return source.substring(start, pos);
    }

    private void skipComment() {
        if (peek() == '[') {
            advance();
            int level = longBracketLevel();
            if (level >= 0) {
                longBracket(level, "comment");
                return;
            }
        }
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void skipShebang() {
        if (peek() == '#') {
            while (!isAtEnd() && peek() != '\n') advance();
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            switch (peek()) {
                case ' ', '\t', '\r', '\n', '\f', '\u000B' -> advance();
                default -> { return; }
            }
        }
    }

    private void opOrAssign(TokenType plain, TokenType compound, String lexeme, int line, int col) {
        if (match('=')) add(compound, lexeme + "=", line, col);
        else add(plain, lexeme, line, col);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexLetter(char c) {
        return (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String message) {
        throw new LexerException("[" + line + ":" + col + "] " + message);
    }
}

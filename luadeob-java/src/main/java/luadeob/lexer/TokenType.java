package luadeob.lexer;

public enum TokenType {

    // literals
    NAME,
    NUMBER,
    STRING,

    // keywords
    AND, BREAK, DO, ELSE, ELSEIF, END,
    FALSE, FOR, FUNCTION, GOTO, IF, IN,
    LOCAL, NIL, NOT, OR, REPEAT, RETURN,
    THEN, TRUE, UNTIL, WHILE,

    // operators
    PLUS, MINUS, STAR, SLASH, DSLASH, PERCENT, CARET, HASH,
    AMP, TILDE, PIPE, SHL, SHR,
    CONCAT, DOTS,
    EQ, NE, LT, LE, GT, GE,
    ASSIGN,

    // compound assignment (Luau)
    PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, DSLASH_ASSIGN,
    PERCENT_ASSIGN, CARET_ASSIGN, CONCAT_ASSIGN,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    DCOLON, COLON, SEMICOLON, COMMA, DOT,

    EOF
}

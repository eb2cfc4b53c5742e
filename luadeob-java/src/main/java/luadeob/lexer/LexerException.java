package luadeob.lexer;

import luadeob.DeobfuscationException;

public final class LexerException extends DeobfuscationException {
    public LexerException(String message) {
        super(message);
    }
}

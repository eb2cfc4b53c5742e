package luadeob.parser;

import luadeob.DeobfuscationException;

public final class ParseException extends DeobfuscationException {
    public ParseException(String message) {
        super(message);
    }
}

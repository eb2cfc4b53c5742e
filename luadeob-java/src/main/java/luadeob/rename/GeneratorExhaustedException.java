package luadeob.rename;

import luadeob.DeobfuscationException;

public final class GeneratorExhaustedException extends DeobfuscationException {
    public GeneratorExhaustedException(String message) {
        super(message);
    }
}

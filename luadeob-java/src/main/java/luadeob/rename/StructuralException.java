package luadeob.rename;

import luadeob.DeobfuscationException;

/** The tree handed to the renamer has a shape it cannot process. */
public final class StructuralException extends DeobfuscationException {
    public StructuralException(String message) {
        super(message);
    }
}

package luadeob;

/**
 * Base of every failure a deobfuscation run can raise. A run that throws
 * one of these produces no output.
 */
public class DeobfuscationException extends RuntimeException {
    public DeobfuscationException(String message) {
        super(message);
    }
}

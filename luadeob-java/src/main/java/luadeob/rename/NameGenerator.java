package luadeob.rename;

import luadeob.lexer.Lexer;

import java.util.Set;

/**
 * Hands out {@code prefix1, prefix2, ...} for one run. Names listed as
 * reserved (every identifier already present in the input) are skipped so
 * a generated local can never capture an existing global.
 */
public final class NameGenerator {
    public static final String DEFAULT_PREFIX = "v";

    private final String prefix;
    private final Set<String> reserved;
    private int counter;

    public NameGenerator() {
        this(DEFAULT_PREFIX, Set.of());
    }

    public NameGenerator(String prefix, Set<String> reserved) {
        this(prefix, reserved, 0);
    }

    // lets tests start close to the end of the counter range
    NameGenerator(String prefix, Set<String> reserved, int start) {
        if (!isValidPrefix(prefix)) {
            throw new IllegalArgumentException("Invalid name prefix: '" + prefix + "'");
        }
        this.prefix = prefix;
        this.reserved = Set.copyOf(reserved);
        this.counter = start;
    }

    public String next() {
        String name;
        do {
            if (counter == Integer.MAX_VALUE) {
                throw new GeneratorExhaustedException("Fresh name space exhausted after " + counter + " names");
            }
            counter++;
            name = prefix + counter;
        } while (reserved.contains(name));
        return name;
    }

    /** How many counter values have been consumed, skipped ones included. */
    public int issued() {
        return counter;
    }

    /** A prefix is usable when it starts a Lua name and is not itself a keyword. */
    public static boolean isValidPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) return false;
        char first = prefix.charAt(0);
        if (!(Character.isLetter(first) && first < 128) && first != '_') return false;
        for (int i = 1; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (!((c < 128 && Character.isLetterOrDigit(c)) || c == '_')) return false;
        }
        return !Lexer.isKeyword(prefix);
    }
}

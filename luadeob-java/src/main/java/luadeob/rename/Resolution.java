package luadeob.rename;

/** Outcome of looking a name up in the {@link ScopeStack}. */
public sealed interface Resolution permits Resolution.Found, Resolution.NotFound {

    /** The name is bound by an enclosing local; use {@code freshName} instead. */
    record Found(String freshName, int depth) implements Resolution {}

    /** No enclosing local binds the name; it is a global and stays as is. */
    record NotFound(String name) implements Resolution {}

    default boolean isFound() {
        return this instanceof Found;
    }
}

package luadeob.rename;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Active scopes, innermost on top. The root scope stands for the global
 * environment and is never popped; the renamer never declares into it.
 */
public final class ScopeStack {
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final NameGenerator names;

    public ScopeStack(NameGenerator names) {
        this.names = names;
        scopes.push(new Scope());
    }

    public void push() { scopes.push(new Scope()); }

    public void pop() {
        if (scopes.size() == 1) throw new StructuralException("Unbalanced scope: attempt to pop the root scope");
        scopes.pop();
    }

    /** Binds {@code name} to a fresh name in the innermost scope and returns it. */
    public String declare(String name) {
        String fresh = names.next();
        scopes.peek().bind(name, fresh);
        return fresh;
    }

    /** Shadows {@code name} in the innermost scope without renaming it. */
    public void bindUnchanged(String name) {
        scopes.peek().bind(name, name);
    }

    public Resolution resolve(String name) {
        int depth = scopes.size() - 1;
        for (Scope s : scopes) {
            String fresh = s.getLocal(name);
            if (fresh != null) return new Resolution.Found(fresh, depth);
            depth--;
        }
        return new Resolution.NotFound(name);
    }

    /** Number of scopes above the root. */
    public int depth() {
        return scopes.size() - 1;
    }
}

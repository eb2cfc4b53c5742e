package luadeob.rename;

import java.util.HashMap;
import java.util.Map;

/** Original name to generated name for one lexical region. */
public final class Scope {
    private final Map<String, String> bindings = new HashMap<>();

    // a later local with the same name in the same block replaces the earlier binding
    public void bind(String original, String fresh) {
        bindings.put(original, fresh);
    }

    public String getLocal(String original) {
        return bindings.get(original);
    }
}

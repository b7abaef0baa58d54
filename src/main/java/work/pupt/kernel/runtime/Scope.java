package work.pupt.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Naming boundary opened by structural components. Children read values through {@link #lookup};
 * a scope never writes to its parent.
 */
public final class Scope {
    private final String name;
    private final Scope parent;
    private final Map<String, Object> values;

    private Scope(String name, Scope parent, Map<String, Object> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = parent;
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Scope root(String name, Map<String, Object> values) {
        return new Scope(name, null, values);
    }

    public Scope child(String childName, Map<String, Object> childValues) {
        return new Scope(childName, this, childValues);
    }

    public String name() {
        return name;
    }

    public Scope parent() {
        return parent;
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object lookup(String key) {
        for (Scope current = this; current != null; current = current.parent) {
            Object value = current.values.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public String path() {
        return parent == null ? name : parent.path() + "/" + name;
    }

    @Override
    public String toString() {
        return "Scope[" + path() + "]";
    }
}

package work.pupt.kernel.element;

import java.util.Objects;
import java.util.Properties;

/**
 * Process-wide symbols shared by every copy of this library loaded in one JVM.
 *
 * <p>Symbols are stored in the system properties table under a fixed, versioned prefix. The first
 * copy to ask for a key creates the token; every later copy, whatever its class loader, receives
 * that same instance. Tokens must only be compared with {@code ==}.
 */
public final class GlobalSymbols {
    private static final String PREFIX = "pupt-kernel.symbol.v1:";

    /** Versioned key tagging element implementations. */
    public static final String ELEMENT_KEY = "pupt-kernel:element:v1";
    /** Versioned key tagging component implementations. */
    public static final String COMPONENT_KEY = "pupt-kernel:component:v1";

    public static final Object ELEMENT = symbolFor(ELEMENT_KEY);
    public static final Object TYPE = symbolFor("pupt-kernel:element:type");
    public static final Object PROPS = symbolFor("pupt-kernel:element:props");
    public static final Object CHILDREN = symbolFor("pupt-kernel:element:children");
    public static final Object FRAGMENT = symbolFor("pupt-kernel:fragment");
    public static final Object TEXT = symbolFor("pupt-kernel:text");

    private GlobalSymbols() {}

    /**
     * Returns the process-wide token for {@code key}, creating it on first use.
     */
    public static Object symbolFor(String key) {
        Objects.requireNonNull(key, "key");
        Properties table = System.getProperties();
        // A fresh String instance keeps the token distinct from any interned literal.
        return table.computeIfAbsent(PREFIX + key, ignored -> new String(key));
    }
}

package work.pupt.kernel.runtime;

import java.util.Map;

/**
 * Render output node whose children are rendered inside a child scope named {@code name}.
 */
public record Scoped(String name, Map<String, Object> values, Object children) {
    public static Scoped within(String name, Map<String, Object> values, Object children) {
        return new Scoped(name, values == null ? Map.of() : values, children);
    }
}

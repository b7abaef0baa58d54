package work.pupt.kernel.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialized props of one element plus its raw children.
 */
public final class Props {
    private final Map<String, Object> values;
    private final List<Object> children;

    public Props(Map<String, Object> values, List<Object> children) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.children = children == null ? List.of() : children;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public List<Object> children() {
        return children;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String string(String name) {
        return string(name, null);
    }

    public String string(String name, String fallback) {
        Object value = values.get(name);
        return value == null ? fallback : value.toString();
    }

    public boolean bool(String name, boolean fallback) {
        Object value = values.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    public Double number(String name) {
        Object value = values.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    public int integer(String name, int fallback) {
        Double value = number(name);
        return value == null ? fallback : value.intValue();
    }

    public List<Object> list(String name) {
        Object value = values.get(name);
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return value == null ? List.of() : List.of(value);
    }

    /**
     * Reads a prop that may be given as one string or as a list of strings.
     */
    public List<String> strings(String name) {
        List<String> out = new ArrayList<>();
        for (Object item : list(name)) {
            if (item != null) {
                out.add(item.toString());
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String name) {
        Object value = values.get(name);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

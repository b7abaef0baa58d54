package work.pupt.kernel.element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the recursive node union: primitives, elements and nested lists.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Flattens nested lists and arrays in place and drops {@code null} entries. A list that contains
     * itself contributes its items once.
     */
    public static List<Object> flatten(Object node) {
        List<Object> out = new ArrayList<>();
        collect(node, out, Collections.newSetFromMap(new IdentityHashMap<>()));
        return out;
    }

    private static void collect(Object node, List<Object> out, Set<Object> open) {
        if (node == null) {
            return;
        }
        if (!(node instanceof Collection<?>) && !(node instanceof Object[])) {
            out.add(node);
            return;
        }
        if (!open.add(node)) {
            return;
        }
        Iterable<?> items = node instanceof Object[] array ? Arrays.asList(array) : (Collection<?>) node;
        for (Object item : items) {
            collect(item, out, open);
        }
        open.remove(node);
    }

    /**
     * Concatenates the primitive text found in {@code node}, ignoring elements.
     */
    public static String textOf(Object node) {
        StringBuilder builder = new StringBuilder();
        for (Object item : flatten(node)) {
            if (item instanceof Element element) {
                if (element.isText() || element.isFragment()) {
                    builder.append(stringify(element.props().get("value")));
                    builder.append(textOf(element.children()));
                }
            } else if (!(item instanceof Boolean) && !(item instanceof DeferredRef)) {
                builder.append(stringify(item));
            }
        }
        return builder.toString();
    }

    /**
     * Renders a plain value as text. Integral floating point numbers lose their fraction.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isInfinite(number) && number == Math.rint(number) && Math.abs(number) < 1e15) {
                return Long.toString((long) number);
            }
            return String.valueOf(number);
        }
        if (value instanceof Collection<?> collection) {
            List<String> parts = new ArrayList<>();
            for (Object item : collection) {
                parts.add(stringify(item));
            }
            return String.join(",", parts);
        }
        if (value instanceof Map<?, ?> map && map.containsKey("value")) {
            return stringify(map.get("value"));
        }
        return String.valueOf(value);
    }

    /**
     * Walks {@code path} through maps and lists. Any missing step yields {@code null}.
     */
    public static Object followPath(Object root, List<Object> path) {
        Object current = root;
        for (Object segment : path) {
            if (current == null) {
                return null;
            }
            if (current instanceof Map<?, ?> map) {
                Object next = map.get(segment);
                if (next == null && !(segment instanceof String)) {
                    next = map.get(String.valueOf(segment));
                }
                current = next;
            } else if (current instanceof List<?> list) {
                int index = indexOf(segment);
                if (index < 0 || index >= list.size()) {
                    return null;
                }
                current = list.get(index);
            } else {
                return null;
            }
        }
        return current;
    }

    private static int indexOf(Object segment) {
        if (segment instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(segment));
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}

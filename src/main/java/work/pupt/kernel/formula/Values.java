package work.pupt.kernel.formula;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

import work.pupt.kernel.element.Nodes;

/**
 * Spreadsheet-style coercions used by formula evaluation.
 */
final class Values {
    private Values() {}

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0 && !Double.isNaN(number.doubleValue());
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.containsKey("value") ? truthy(map.get("value")) : !map.isEmpty();
        }
        return true;
    }

    static boolean blank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        return value instanceof Collection<?> collection && collection.isEmpty();
    }

    static boolean equal(Object a, Object b) {
        Object left = unwrap(a);
        Object right = unwrap(b);
        if (blank(left) || blank(right)) {
            return blank(left) && blank(right);
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return left instanceof Boolean && right instanceof Boolean && left.equals(right);
        }
        if (left instanceof Number x && right instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (left instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> equal(item, right));
        }
        return Nodes.stringify(left).toLowerCase(Locale.ROOT)
            .equals(Nodes.stringify(right).toLowerCase(Locale.ROOT));
    }

    static boolean ordered(String operator, Object a, Object b) {
        Double x = number(unwrap(a));
        Double y = number(unwrap(b));
        if (x == null || y == null) {
            return false;
        }
        int cmp = Double.compare(x, y);
        return switch (operator) {
            case "<" -> cmp < 0;
            case ">" -> cmp > 0;
            case "<=" -> cmp <= 0;
            case ">=" -> cmp >= 0;
            default -> throw new IllegalArgumentException("Unknown operator: " + operator);
        };
    }

    private static Object unwrap(Object value) {
        if (value instanceof Map<?, ?> map && map.containsKey("value")) {
            return map.get("value");
        }
        return value;
    }

    private static Double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof CharSequence text) {
            try {
                return Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}

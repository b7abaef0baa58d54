package work.pupt.kernel.schema;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Kinds of prop values a schema can require.
 */
public enum PropType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    LIST("array"),
    MAP("object"),
    ANY("any");

    private final String label;

    PropType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case NUMBER -> value instanceof Number;
            case INTEGER -> value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue());
            case BOOLEAN -> value instanceof Boolean;
            case LIST -> value instanceof List<?> || value instanceof Object[];
            case MAP -> value instanceof Map<?, ?>;
            case ANY -> true;
        };
    }

    /**
     * Describes the runtime kind of {@code value} using the same labels.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "undefined";
        }
        for (PropType type : values()) {
            if (type != INTEGER && type != ANY && type.matches(value)) {
                return type.label;
            }
        }
        return value.getClass().getSimpleName();
    }

    public static PropType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "string", "text" -> STRING;
            case "number", "float", "double" -> NUMBER;
            case "integer", "int" -> INTEGER;
            case "boolean", "bool" -> BOOLEAN;
            case "array", "list" -> LIST;
            case "object", "map", "table" -> MAP;
            case "any" -> ANY;
            default -> throw new IllegalArgumentException("Unsupported prop type: " + raw);
        };
    }
}

package work.pupt.kernel.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import work.pupt.kernel.runtime.RenderError;

/**
 * Checks materialized props against a {@link PropSchema} and reports every problem found.
 */
public final class PropValidator {
    private PropValidator() {}

    public static List<RenderError> validate(String component, Map<String, Object> props, PropSchema schema) {
        List<RenderError> errors = new ArrayList<>();
        for (PropSpec spec : schema.props().values()) {
            checkProp(component, spec, props.get(spec.name()), errors);
        }
        if (schema.strict()) {
            for (String key : props.keySet()) {
                if (schema.prop(key) == null) {
                    errors.add(new RenderError(component, key, "Unrecognized key: '" + key + "'",
                        RenderError.UNRECOGNIZED_KEYS, List.of(key), key, null));
                }
            }
        }
        return errors;
    }

    private static void checkProp(String component, PropSpec spec, Object value, List<RenderError> errors) {
        String name = spec.name();
        if (value == null) {
            if (spec.required()) {
                errors.add(new RenderError(component, name, "Required", RenderError.INVALID_TYPE,
                    List.of(name), "undefined", expected(spec)));
            }
            return;
        }
        if (spec.types().stream().noneMatch(type -> type.matches(value))) {
            errors.add(new RenderError(component, name,
                "Expected " + expected(spec) + ", received " + PropType.describe(value),
                RenderError.INVALID_TYPE, List.of(name), PropType.describe(value), expected(spec)));
            return;
        }
        if (!spec.values().isEmpty() && !allowed(spec, value)) {
            errors.add(new RenderError(component, name,
                "Invalid enum value. Expected " + spec.values() + ", received '" + value + "'",
                RenderError.INVALID_ENUM_VALUE, List.of(name), value, spec.values()));
            return;
        }
        if (value instanceof Number number) {
            double actual = number.doubleValue();
            if (spec.min() != null && actual < spec.min()) {
                errors.add(new RenderError(component, name,
                    "Number must be greater than or equal to " + format(spec.min()),
                    RenderError.TOO_SMALL, List.of(name), value, spec.min()));
            } else if (spec.max() != null && actual > spec.max()) {
                errors.add(new RenderError(component, name,
                    "Number must be less than or equal to " + format(spec.max()),
                    RenderError.TOO_BIG, List.of(name), value, spec.max()));
            }
        }
        if (spec.items() != null && (value instanceof List<?> || value instanceof Object[])) {
            List<?> items = value instanceof Object[] array ? Arrays.asList(array) : (List<?>) value;
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                if (!spec.items().matches(item)) {
                    errors.add(new RenderError(component, name,
                        "Expected " + spec.items().label() + ", received " + PropType.describe(item),
                        RenderError.INVALID_TYPE, List.of(name, i), PropType.describe(item), spec.items().label()));
                }
            }
        }
    }

    private static boolean allowed(PropSpec spec, Object value) {
        String raw = value.toString();
        return spec.values().stream().anyMatch(candidate -> String.valueOf(candidate).equals(raw));
    }

    private static String expected(PropSpec spec) {
        return spec.types().stream().map(PropType::label).sorted().collect(Collectors.joining(" | "));
    }

    private static String format(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}

package work.pupt.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured problem recorded during a render. Codes starting with {@code warn_} are warnings.
 */
public record RenderError(
    String component,
    String prop,
    String message,
    String code,
    List<Object> path,
    Object received,
    Object expected
) {
    public static final String INVALID_TYPE = "invalid_type";
    public static final String INVALID_ENUM_VALUE = "invalid_enum_value";
    public static final String TOO_SMALL = "too_small";
    public static final String TOO_BIG = "too_big";
    public static final String UNRECOGNIZED_KEYS = "unrecognized_keys";
    public static final String MISSING_SCHEMA = "missing_schema";
    public static final String RUNTIME_ERROR = "runtime_error";
    public static final String UNKNOWN_COMPONENT = "unknown_component";
    public static final String CIRCULAR_REFERENCE = "circular_reference";
    public static final String MAX_DEPTH_EXCEEDED = "max_depth_exceeded";

    public RenderError {
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static RenderError of(String component, String code, String message) {
        return new RenderError(component, null, message, code, List.of(), null, null);
    }

    public static RenderError runtime(String component, Throwable cause) {
        String detail = cause.getMessage();
        if (detail == null || detail.isBlank()) {
            detail = cause.getClass().getSimpleName();
        }
        return of(component, RUNTIME_ERROR, "Runtime error in " + component + ": " + detail);
    }

    public static RenderError warning(String component, String code, String message) {
        if (!code.startsWith("warn_")) {
            throw new IllegalArgumentException("Warning codes must start with warn_: " + code);
        }
        return of(component, code, message);
    }

    public boolean isWarning() {
        return code != null && code.startsWith("warn_");
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("component", component);
        map.put("prop", prop);
        map.put("message", message);
        map.put("code", code);
        map.put("path", path);
        if (received != null) {
            map.put("received", received);
        }
        if (expected != null) {
            map.put("expected", expected);
        }
        return map;
    }

    @Override
    public String toString() {
        return component + (prop != null ? "." + prop : "") + ": " + message + " [" + code + "]";
    }
}

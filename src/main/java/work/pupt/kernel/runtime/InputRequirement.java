package work.pupt.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input an interactive component needs, as seen during one render.
 */
public record InputRequirement(
    String name,
    String label,
    String description,
    String type,
    boolean required,
    Object defaultValue,
    List<Map<String, Object>> options,
    Double min,
    Double max,
    String scope
) {
    public InputRequirement {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("label", label);
        if (description != null) {
            map.put("description", description);
        }
        map.put("type", type);
        map.put("required", required);
        if (defaultValue != null) {
            map.put("default", defaultValue);
        }
        if (!options.isEmpty()) {
            map.put("options", options);
        }
        if (min != null) {
            map.put("min", min);
        }
        if (max != null) {
            map.put("max", max);
        }
        if (scope != null) {
            map.put("scope", scope);
        }
        return map;
    }
}

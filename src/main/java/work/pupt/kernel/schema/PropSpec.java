package work.pupt.kernel.schema;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Expected shape of one prop.
 *
 * @param types accepted kinds; a value matching any of them passes
 * @param values allowed values when non-empty, compared after {@code toString()}
 * @param items kind required for every list entry, or {@code null}
 */
public record PropSpec(
    String name,
    Set<PropType> types,
    boolean required,
    List<Object> values,
    Double min,
    Double max,
    PropType items
) {
    public PropSpec {
        Objects.requireNonNull(name, "name");
        types = types == null || types.isEmpty() ? Set.of(PropType.ANY) : Set.copyOf(types);
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static PropSpec of(String name, PropType type, boolean required) {
        return new PropSpec(name, Set.of(type), required, List.of(), null, null, null);
    }
}

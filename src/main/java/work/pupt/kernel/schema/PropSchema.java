package work.pupt.kernel.schema;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit prop schema of a component: field name to expected shape.
 *
 * <p>Non-strict schemas accept props they do not declare.
 */
public final class PropSchema {
    private final Map<String, PropSpec> props;
    private final boolean strict;

    private PropSchema(Map<String, PropSpec> props, boolean strict) {
        this.props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
        this.strict = strict;
    }

    public Map<String, PropSpec> props() {
        return props;
    }

    public PropSpec prop(String name) {
        return props.get(name);
    }

    public boolean strict() {
        return strict;
    }

    public static PropSchema empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PropSchema" + props.keySet() + (strict ? " strict" : "");
    }

    public static final class Builder {
        private final Map<String, PropSpec> props = new LinkedHashMap<>();
        private boolean strict;

        private Builder() {}

        public Builder required(String name, PropType type, PropType... more) {
            return add(name, true, type, more);
        }

        public Builder optional(String name, PropType type, PropType... more) {
            return add(name, false, type, more);
        }

        public Builder oneOf(String name, boolean required, Object... allowed) {
            props.put(name, new PropSpec(name, EnumSet.of(PropType.STRING), required, List.of(allowed), null, null, null));
            return this;
        }

        public Builder range(String name, boolean required, Double min, Double max) {
            props.put(name, new PropSpec(name, EnumSet.of(PropType.NUMBER), required, List.of(), min, max, null));
            return this;
        }

        public Builder listOf(String name, boolean required, PropType items) {
            props.put(name, new PropSpec(name, EnumSet.of(PropType.LIST), required, List.of(), null, null, items));
            return this;
        }

        public Builder spec(PropSpec spec) {
            props.put(Objects.requireNonNull(spec, "spec").name(), spec);
            return this;
        }

        public Builder strict(boolean value) {
            this.strict = value;
            return this;
        }

        public PropSchema build() {
            return new PropSchema(props, strict);
        }

        private Builder add(String name, boolean required, PropType type, PropType... more) {
            EnumSet<PropType> types = EnumSet.of(type, more);
            props.put(name, new PropSpec(name, types, required, List.of(), null, null, null));
            return this;
        }
    }
}

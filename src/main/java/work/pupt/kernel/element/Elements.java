package work.pupt.kernel.element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import work.pupt.kernel.runtime.Component;

/**
 * Builders for element trees.
 */
public final class Elements {
    public static final Object FRAGMENT = GlobalSymbols.FRAGMENT;
    public static final Object TEXT = GlobalSymbols.TEXT;

    private Elements() {}

    public static Element element(Component component, Map<String, Object> props, Object... children) {
        return create(component, props, Arrays.asList(children));
    }

    public static Element element(Component component, Object... children) {
        return create(component, null, Arrays.asList(children));
    }

    public static Element fragment(Object... children) {
        return create(FRAGMENT, null, Arrays.asList(children));
    }

    public static Element text(Object value) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("value", value);
        return create(TEXT, props, List.of());
    }

    /**
     * Builds an element from a raw type. A {@code children} entry in {@code props} is appended to
     * the explicit children.
     */
    public static Element create(Object type, Map<String, Object> props, List<?> children) {
        Objects.requireNonNull(type, "type");
        if (!(type instanceof Component) && type != FRAGMENT && type != TEXT && !Identity.isComponent(type)) {
            throw new IllegalArgumentException("Unsupported element type: " + type);
        }
        Map<String, Object> ownProps = new LinkedHashMap<>();
        List<Object> flat = new ArrayList<>(Nodes.flatten(children));
        if (props != null) {
            for (var entry : props.entrySet()) {
                if ("children".equals(entry.getKey())) {
                    flat.addAll(Nodes.flatten(entry.getValue()));
                } else {
                    ownProps.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return new Element(type, ownProps, flat);
    }

    /**
     * Builds a property map from alternating keys and values.
     */
    public static Map<String, Object> props(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("props expects key/value pairs");
        }
        Map<String, Object> props = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return props;
    }

    public static Builder builder(Component component) {
        return new Builder(component);
    }

    public static final class Builder {
        private final Component component;
        private final Map<String, Object> props = new LinkedHashMap<>();
        private final List<Object> children = new ArrayList<>();

        private Builder(Component component) {
            this.component = Objects.requireNonNull(component, "component");
        }

        public Builder prop(String name, Object value) {
            props.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder props(Map<String, Object> values) {
            if (values != null) {
                props.putAll(values);
            }
            return this;
        }

        public Builder child(Object child) {
            children.add(child);
            return this;
        }

        public Builder children(Object... values) {
            children.addAll(Arrays.asList(values));
            return this;
        }

        public Element build() {
            return create(component, props, children);
        }
    }
}

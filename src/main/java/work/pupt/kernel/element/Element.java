package work.pupt.kernel.element;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import work.pupt.kernel.runtime.Component;

/**
 * Immutable description of one document node: a type, a property bag and ordered children.
 *
 * <p>Elements compare by identity. Their slots are also reachable through {@link #apply(Object)}
 * using the {@link GlobalSymbols} tokens, which is how a copy of the library loaded by another
 * class loader reads them.
 */
public final class Element implements Function<Object, Object> {
    public static final String ELEMENT_MARKER = GlobalSymbols.ELEMENT_KEY;

    private final Object type;
    private final Map<String, Object> props;
    private final List<Object> children;

    Element(Object type, Map<String, Object> props, List<Object> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.props = props == null || props.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        this.children = children == null || children.isEmpty()
            ? List.of()
            : Collections.unmodifiableList(Arrays.asList(children.toArray()));
    }

    public Object type() {
        return type;
    }

    public Map<String, Object> props() {
        return props;
    }

    public List<Object> children() {
        return children;
    }

    public boolean isFragment() {
        return type == GlobalSymbols.FRAGMENT;
    }

    public boolean isText() {
        return type == GlobalSymbols.TEXT;
    }

    /**
     * Returns the component held by this element, or {@code null} for markers and foreign types.
     */
    public Component component() {
        return type instanceof Component component ? component : null;
    }

    public String typeName() {
        if (isFragment()) {
            return "Fragment";
        }
        if (isText()) {
            return "Text";
        }
        if (type instanceof Component component) {
            return component.name();
        }
        String foreign = Identity.componentName(type);
        return foreign != null ? foreign : String.valueOf(type);
    }

    /**
     * Creates a deferred reference into this element's resolved value.
     */
    public DeferredRef ref(Object... path) {
        return new DeferredRef(this, path == null ? List.of() : Arrays.asList(path));
    }

    @Override
    public Object apply(Object slot) {
        if (slot == GlobalSymbols.ELEMENT) {
            return Boolean.TRUE;
        }
        if (slot == GlobalSymbols.TYPE) {
            return type;
        }
        if (slot == GlobalSymbols.PROPS) {
            return props;
        }
        if (slot == GlobalSymbols.CHILDREN) {
            return children;
        }
        return null;
    }

    @Override
    public String toString() {
        return "<" + typeName() + " " + props + ">";
    }
}

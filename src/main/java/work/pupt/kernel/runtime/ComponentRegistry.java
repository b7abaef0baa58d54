package work.pupt.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name to component lookup used while elements are constructed.
 */
public final class ComponentRegistry {
    private final Map<String, Component> components = Collections.synchronizedMap(new LinkedHashMap<>());

    public ComponentRegistry register(Component component) {
        return register(component.name(), component);
    }

    public ComponentRegistry register(String name, Component component) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(component, "component");
        components.put(name, component);
        return this;
    }

    public Component get(String name) {
        return name == null ? null : components.get(name);
    }

    public Optional<Component> find(String name) {
        return Optional.ofNullable(get(name));
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public void unregister(String name) {
        if (name != null) {
            components.remove(name);
        }
    }

    public Map<String, Component> entries() {
        synchronized (components) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(components));
        }
    }

    public ComponentRegistry copy() {
        ComponentRegistry copy = new ComponentRegistry();
        entries().forEach(copy::register);
        return copy;
    }
}

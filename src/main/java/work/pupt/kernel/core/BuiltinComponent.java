package work.pupt.kernel.core;

import java.util.Objects;

import work.pupt.kernel.runtime.Component;
import work.pupt.kernel.schema.PropSchema;

/**
 * Base of the built-in components: a fixed name and a schema taken from the bundled manifest.
 */
public abstract class BuiltinComponent implements Component {
    private final String name;

    protected BuiltinComponent(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public PropSchema schema() {
        return BuiltinSchemas.forComponent(name);
    }

    @Override
    public String toString() {
        return name;
    }
}

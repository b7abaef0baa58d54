package work.pupt.kernel.core;

import java.util.Map;
import java.util.Set;

import work.pupt.kernel.schema.PropSchema;
import work.pupt.kernel.schema.PropSchemaLoader;

/**
 * Prop schemas of the built-in components, read once from {@value #RESOURCE}.
 */
public final class BuiltinSchemas {
    public static final String RESOURCE = "/pupt/components.toml";

    private BuiltinSchemas() {}

    public static PropSchema forComponent(String name) {
        return Holder.SCHEMAS.get(name);
    }

    public static Set<String> names() {
        return Holder.SCHEMAS.keySet();
    }

    private static final class Holder {
        static final Map<String, PropSchema> SCHEMAS = Map.copyOf(PropSchemaLoader.fromResource(RESOURCE));
    }
}

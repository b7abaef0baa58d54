package work.pupt.kernel.schema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads component prop schemas from a TOML manifest.
 *
 * <pre>
 * [components."Ask.Text"]
 * strict = false
 *
 * [components."Ask.Text".props.name]
 * type = "string"
 * required = true
 * </pre>
 */
public final class PropSchemaLoader {
    private PropSchemaLoader() {}

    public static Map<String, PropSchema> load(Path manifestPath) throws IOException {
        return parse(Files.readString(manifestPath), manifestPath.toString());
    }

    public static Map<String, PropSchema> fromResource(String resource) {
        try (InputStream in = PropSchemaLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema manifest not found on classpath: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read schema manifest " + resource, ex);
        }
    }

    public static Map<String, PropSchema> parse(String source, String origin) {
        TomlParseResult result = Toml.parse(source);
        if (result.hasErrors()) {
            String details = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid schema manifest " + origin + ": " + details);
        }
        return fromToml(result);
    }

    public static Map<String, PropSchema> fromToml(TomlTable root) {
        Map<String, PropSchema> schemas = new LinkedHashMap<>();
        TomlTable components = root.getTable("components");
        if (components == null) {
            return schemas;
        }
        for (String name : components.keySet()) {
            TomlTable table = components.getTable(List.of(name));
            if (table != null) {
                schemas.put(name, readSchema(name, table));
            }
        }
        return schemas;
    }

    private static PropSchema readSchema(String component, TomlTable table) {
        PropSchema.Builder builder = PropSchema.builder();
        builder.strict(Boolean.TRUE.equals(table.getBoolean("strict")));
        TomlTable props = table.getTable("props");
        if (props != null) {
            for (String prop : props.keySet()) {
                TomlTable spec = props.getTable(List.of(prop));
                if (spec == null) {
                    throw new IllegalArgumentException("Prop " + component + "." + prop + " must be a table");
                }
                builder.spec(readSpec(prop, spec));
            }
        }
        return builder.build();
    }

    private static PropSpec readSpec(String name, TomlTable spec) {
        EnumSet<PropType> types = EnumSet.noneOf(PropType.class);
        Object rawType = spec.get("type");
        if (rawType instanceof TomlArray array) {
            for (Object item : array.toList()) {
                types.add(PropType.from(String.valueOf(item)));
            }
        } else if (rawType != null) {
            types.add(PropType.from(rawType.toString()));
        }
        List<Object> values = new ArrayList<>();
        TomlArray allowed = spec.getArray("enum");
        if (allowed != null) {
            values.addAll(allowed.toList());
        }
        String items = spec.getString("items");
        return new PropSpec(
            name,
            types,
            Boolean.TRUE.equals(spec.getBoolean("required")),
            values,
            number(spec.get("min")),
            number(spec.get("max")),
            items == null ? null : PropType.from(items)
        );
    }

    private static Double number(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }
}

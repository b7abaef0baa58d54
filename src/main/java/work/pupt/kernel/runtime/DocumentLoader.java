package work.pupt.kernel.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import work.pupt.kernel.element.DeferredRef;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Elements;

/**
 * Builds element trees from their YAML or JSON description.
 *
 * <pre>
 * type: Prompt
 * props: { name: demo }
 * children:
 *   - type: Ask.Confirm
 *     id: tests
 *     props: { name: tests, default: false, silent: true }
 *   - type: If
 *     props: { formula: "=tests" }
 *     children: [ "Include tests." ]
 *   - { $ref: tests }
 * </pre>
 *
 * <p>An element gets an {@code id} to be referenced later in document order. {@code {$ref: id}}
 * reuses the element; adding {@code path} makes it a deferred reference into its resolved value.
 * Inside props, {@code {$element: {...}}} embeds an element. A list at the root becomes a fragment.
 */
public final class DocumentLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final ComponentRegistry registry;

    public DocumentLoader(ComponentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Element load(Path path) {
        String fileName = String.valueOf(path.getFileName());
        ObjectMapper mapper = fileName.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            return build(mapper.readTree(in), path.toString());
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to read document: " + path, ex);
        }
    }

    /**
     * Parses YAML or JSON text.
     */
    public Element parse(String content) {
        try {
            return build(YAML_MAPPER.readTree(content), "<inline>");
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to parse document: " + ex.getMessage(), ex);
        }
    }

    private Element build(JsonNode root, String origin) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new DocumentLoadException("Empty document: " + origin);
        }
        var ids = new HashMap<String, Element>();
        if (root.isArray()) {
            return Elements.fragment(children(root, ids).toArray());
        }
        Object node = child(root, ids);
        if (node instanceof Element element) {
            return element;
        }
        throw new DocumentLoadException("Document root must be an element: " + origin);
    }

    private Element element(JsonNode node, Map<String, Element> ids) {
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new DocumentLoadException("Element is missing a type: " + node);
        }
        String typeName = typeNode.asText();
        Map<String, Object> props = new LinkedHashMap<>();
        JsonNode propsNode = node.get("props");
        if (propsNode != null && !propsNode.isNull()) {
            if (!propsNode.isObject()) {
                throw new DocumentLoadException("props of " + typeName + " must be an object");
            }
            var fields = propsNode.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                props.put(field.getKey(), value(field.getValue(), ids));
            }
        }
        List<Object> children = children(node.get("children"), ids);
        Element element = switch (typeName) {
            case "Fragment" -> Elements.create(Elements.FRAGMENT, props, children);
            case "Text" -> Elements.create(Elements.TEXT, props, children);
            default -> {
                Component component = registry.get(typeName);
                if (component == null) {
                    throw new DocumentLoadException("Unknown component: " + typeName);
                }
                yield Elements.create(component, props, children);
            }
        };
        JsonNode id = node.get("id");
        if (id != null && !id.isNull()) {
            if (ids.putIfAbsent(id.asText(), element) != null) {
                throw new DocumentLoadException("Duplicate element id: " + id.asText());
            }
        }
        return element;
    }

    private List<Object> children(JsonNode node, Map<String, Element> ids) {
        List<Object> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            out.add(child(node, ids));
            return out;
        }
        for (JsonNode item : node) {
            out.add(child(item, ids));
        }
        return out;
    }

    private Object child(JsonNode node, Map<String, Element> ids) {
        if (node.isObject()) {
            if (node.has("$ref")) {
                return reference(node, ids);
            }
            return element(node, ids);
        }
        if (node.isArray()) {
            return children(node, ids);
        }
        return scalar(node);
    }

    private Object value(JsonNode node, Map<String, Element> ids) {
        if (node.isObject()) {
            if (node.has("$ref")) {
                return reference(node, ids);
            }
            if (node.has("$element")) {
                return element(node.get("$element"), ids);
            }
            Map<String, Object> map = new LinkedHashMap<>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                map.put(field.getKey(), value(field.getValue(), ids));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonNode item : node) {
                list.add(value(item, ids));
            }
            return list;
        }
        return scalar(node);
    }

    private Object reference(JsonNode node, Map<String, Element> ids) {
        String id = node.get("$ref").asText();
        Element target = ids.get(id);
        if (target == null) {
            throw new DocumentLoadException("Reference to unknown or later element: " + id);
        }
        JsonNode path = node.get("path");
        if (path == null || path.isNull()) {
            return target;
        }
        List<Object> segments = new ArrayList<>();
        if (path.isArray()) {
            for (JsonNode segment : path) {
                segments.add(segment.isNumber() ? (Object) segment.intValue() : segment.asText());
            }
        } else {
            for (String segment : path.asText().split("\\.")) {
                segments.add(segment);
            }
        }
        return new DeferredRef(target, segments);
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.toString();
    }
}

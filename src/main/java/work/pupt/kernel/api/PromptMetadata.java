package work.pupt.kernel.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import work.pupt.kernel.core.structural.Prompt;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Nodes;

/**
 * Declared metadata of a prompt document, read from its root {@code Prompt} element without
 * rendering.
 */
public record PromptMetadata(String name, String title, String version, String description, List<String> tags) {
    public PromptMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Finds the first {@code Prompt} element at the root or directly inside root fragments.
     */
    public static Optional<PromptMetadata> extract(Element root) {
        if (root == null) {
            return Optional.empty();
        }
        if (root.component() instanceof Prompt) {
            return Optional.of(from(root.props()));
        }
        if (root.isFragment()) {
            for (Object child : Nodes.flatten(root.children())) {
                if (child instanceof Element element) {
                    Optional<PromptMetadata> found = extract(element);
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static PromptMetadata from(Map<String, Object> props) {
        List<String> tags = new ArrayList<>();
        if (props.get("tags") instanceof List<?> list) {
            for (Object tag : list) {
                if (tag instanceof String text) {
                    tags.add(text);
                }
            }
        }
        return new PromptMetadata(
            text(props.get("name")),
            text(props.get("title")),
            text(props.get("version")),
            text(props.get("description")),
            tags
        );
    }

    private static String text(Object value) {
        return value instanceof String text ? text : null;
    }
}

package work.pupt.kernel.element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Placeholder prop value meaning "the value at {@code path} inside the resolved value of
 * {@code element}".
 */
public record DeferredRef(Element element, List<Object> path) {
    public DeferredRef {
        Objects.requireNonNull(element, "element");
        path = path == null ? List.of() : List.copyOf(path);
    }

    /**
     * Extends the path by one segment.
     */
    public DeferredRef get(Object segment) {
        Objects.requireNonNull(segment, "segment");
        List<Object> extended = new ArrayList<>(path);
        extended.add(segment);
        return new DeferredRef(element, extended);
    }

    @Override
    public String toString() {
        return "ref(" + element.typeName() + ")" + (path.isEmpty() ? "" : path.toString());
    }
}

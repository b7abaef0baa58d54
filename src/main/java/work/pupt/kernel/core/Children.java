package work.pupt.kernel.core;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Nodes;
import work.pupt.kernel.runtime.Component;

/**
 * Inspects raw children without rendering them. Fragments are looked through.
 */
public final class Children {
    private Children() {}

    public static <T extends Component> List<Element> ofType(List<Object> children, Class<T> type) {
        List<Element> found = new ArrayList<>();
        collect(children, type, found);
        return found;
    }

    public static <T extends Component> boolean contains(List<Object> children, Class<T> type) {
        return !ofType(children, type).isEmpty();
    }

    private static void collect(Object node, Class<? extends Component> type, List<Element> found) {
        for (Object item : Nodes.flatten(node)) {
            if (!(item instanceof Element element)) {
                continue;
            }
            if (element.isFragment()) {
                collect(element.children(), type, found);
            } else if (type.isInstance(element.component())) {
                found.add(element);
            }
        }
    }
}

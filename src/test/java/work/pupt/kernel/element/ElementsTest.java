package work.pupt.kernel.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.core.structural.Task;

class ElementsTest {
    private static final Task TASK = new Task();

    @Test
    void childrenPropIsMergedAfterExplicitChildren() {
        var element = Elements.create(TASK, Elements.props("children", List.of("a", List.of("b")), "x", 1), List.of("c"));

        assertEquals(List.of("c", "a", "b"), element.children());
        assertEquals(Map.of("x", 1), element.props());
        assertSame(TASK, element.component());
    }

    @Test
    void unsupportedTypesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Elements.create("Task", null, List.of()));
        assertThrows(NullPointerException.class, () -> Elements.create(null, null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> Elements.props("odd"));
    }

    @Test
    void elementsAreImmutableSnapshots() {
        var props = new LinkedHashMap<String, Object>();
        props.put("k", "v");
        var element = Elements.element(TASK, props, "child");
        props.put("k", "changed");

        assertEquals("v", element.props().get("k"));
        assertThrows(UnsupportedOperationException.class, () -> element.props().put("k", "x"));
        assertThrows(UnsupportedOperationException.class, () -> element.children().add("x"));
    }

    @Test
    void slotsAreReadableThroughSharedSymbols() {
        var element = Elements.element(TASK, "body");

        assertEquals(Boolean.TRUE, element.apply(GlobalSymbols.ELEMENT));
        assertSame(TASK, element.apply(GlobalSymbols.TYPE));
        assertEquals(List.of("body"), element.apply(GlobalSymbols.CHILDREN));
        assertNull(element.apply(new String("pupt-kernel:element:type")));
    }

    @Test
    void builderAndMarkers() {
        var built = Elements.builder(TASK).prop("a", 1).children("x", "y").child("z").build();

        assertEquals(List.of("x", "y", "z"), built.children());
        assertEquals("Task", built.typeName());
        assertTrue(Elements.fragment().isFragment());
        assertEquals("Fragment", Elements.fragment().typeName());
        assertEquals("Text", Elements.text("hi").typeName());
        assertEquals("hi", Nodes.textOf(Elements.fragment(Elements.text("h"), "i", Elements.element(TASK, "skipped"))));
    }

    @Test
    void referencesExtendTheirPath() {
        var element = Elements.element(TASK);
        var ref = element.ref("rating").get("label");

        assertSame(element, ref.element());
        assertEquals(List.of("rating", "label"), ref.path());
        assertEquals(List.of(), element.ref().path());
    }

    @Test
    void valuesStringifyAndPathsWalk() {
        assertEquals("3", Nodes.stringify(3.0));
        assertEquals("2.5", Nodes.stringify(2.5));
        assertEquals("4", Nodes.stringify(Map.of("value", 4, "label", "Good")));
        assertEquals("a,b", Nodes.stringify(List.of("a", "b")));
        assertEquals("", Nodes.stringify(null));

        var data = Map.of("items", List.of(Map.of("name", "first")), "7", "seven");
        assertEquals("first", Nodes.followPath(data, List.of("items", 0, "name")));
        assertEquals("first", Nodes.followPath(data, List.of("items", "0", "name")));
        assertEquals("seven", Nodes.followPath(data, List.of(7)));
        assertNull(Nodes.followPath(data, List.of("items", 3)));
        assertNull(Nodes.followPath("scalar", List.of("x")));
    }
}

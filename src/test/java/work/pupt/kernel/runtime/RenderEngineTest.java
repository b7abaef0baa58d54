package work.pupt.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.element.Elements;

class RenderEngineTest {
    private static String render(Object root, RenderContext context) {
        return new RenderEngine(context, 32, false).render(root);
    }

    @Test
    void flattensNestedChildrenAndDropsAbsentValues() {
        var context = new RenderContext(new ComponentRegistry());
        var tree = Elements.fragment("a", List.of("b", Arrays.asList(null, "c")), null, 4, true, 2.5);

        assertEquals("abc42.5", render(tree, context));
        assertTrue(context.errors().isEmpty());
    }

    @Test
    void deferredReferencesResolveOnceAndShareTheValue() {
        var context = new RenderContext(new ComponentRegistry());
        var source = new SampleComponents.Counter(Map.of("rating", Map.of("value", 4, "label", "Good")));
        var sourceElement = Elements.element(source);
        var echo = new SampleComponents.Echo();
        var tree = Elements.fragment(
            Elements.element(echo, Elements.props("text", sourceElement.ref("rating", "label"))),
            " / ",
            Elements.element(echo, Elements.props("text", sourceElement.ref("rating").get("label")))
        );

        assertEquals("Good / Good", render(tree, context));
        assertEquals(1, source.resolves);
        assertTrue(context.errors().isEmpty());
    }

    @Test
    void elementPropsAreReplacedByTheirResolvedValue() {
        var context = new RenderContext(new ComponentRegistry());
        var source = new SampleComponents.Counter(List.of("x", "y"));
        var probe = new SampleComponents.Probe();
        var sourceElement = Elements.element(source);
        var tree = Elements.fragment(
            Elements.element(probe, Elements.props(
                "whole", sourceElement,
                "second", sourceElement.ref(1),
                "nested", List.of(sourceElement.ref(0)),
                "missing", sourceElement.ref("nope", "deeper")
            ))
        );

        render(tree, context);

        Map<String, Object> seen = probe.seen.get(0);
        assertEquals(List.of("x", "y"), seen.get("whole"));
        assertEquals("y", seen.get("second"));
        assertEquals(List.of("x"), seen.get("nested"));
        assertNull(seen.get("missing"));
        assertEquals(1, source.resolves);
        assertTrue(context.errors().isEmpty());
    }

    @Test
    void validationFailureFallsBackToChildrenAndKeepsSiblings() {
        var context = new RenderContext(new ComponentRegistry());
        var echo = new SampleComponents.Echo();
        var tree = Elements.fragment(
            Elements.element(echo, Elements.props("text", "first ")),
            Elements.element(echo, Elements.props("text", 42), "fallback "),
            Elements.element(echo, Elements.props("text", "last"))
        );

        assertEquals("first fallback last", render(tree, context));
        assertEquals(1, context.errors().size());
        RenderError error = context.errors().get(0);
        assertEquals("Echo", error.component());
        assertEquals("text", error.prop());
        assertEquals(RenderError.INVALID_TYPE, error.code());
        assertIterableEquals(List.of("text"), error.path());
        assertEquals("number", error.received());
        assertEquals("string", error.expected());
    }

    @Test
    void runtimeExceptionsAreContainedAtTheNode() {
        var context = new RenderContext(new ComponentRegistry());
        var tree = Elements.fragment(
            "before ",
            Elements.element(new SampleComponents.Exploding(false), "kept"),
            " after"
        );

        assertEquals("before kept after", render(tree, context));
        assertEquals(1, context.errors().size());
        assertEquals(RenderError.RUNTIME_ERROR, context.errors().get(0).code());
        assertEquals("Runtime error in Exploding: boom", context.errors().get(0).message());
    }

    @Test
    void resolveFailureMakesReferencesAbsent() {
        var context = new RenderContext(new ComponentRegistry());
        var failing = Elements.element(new SampleComponents.Exploding(true), "fallback");
        var probe = new SampleComponents.Probe();
        var tree = Elements.fragment(
            Elements.element(probe, Elements.props("value", failing.ref("anything"))),
            failing
        );

        assertEquals("fallback", render(tree, context));
        assertNull(probe.seen.get(0).get("value"));
        assertEquals(1, context.errors().size());
    }

    @Test
    void strictValidationReportsComponentsWithoutSchema() {
        var context = new RenderContext(new ComponentRegistry());
        var tree = Elements.element(new SampleComponents.Counter("v"), "child");

        assertEquals("child", new RenderEngine(context, 32, true).render(tree));
        assertEquals(RenderError.MISSING_SCHEMA, context.errors().get(0).code());

        var lenient = new RenderContext(new ComponentRegistry());
        assertEquals("[v]", render(tree, lenient));
        assertTrue(lenient.errors().isEmpty());
    }

    @Test
    void depthLimitStopsRunawayRecursion() {
        var context = new RenderContext(new ComponentRegistry());
        var tree = Elements.element(new SampleComponents.Recursive());

        assertEquals("", new RenderEngine(context, 10, false).render(tree));
        assertEquals(1, context.errors().size());
        assertEquals(RenderError.MAX_DEPTH_EXCEEDED, context.errors().get(0).code());

        var twoLevels = new RenderContext(new ComponentRegistry());
        assertEquals("leaf", new RenderEngine(twoLevels, 2, false)
            .render(Elements.fragment(Elements.fragment("leaf"))));
        assertTrue(twoLevels.errors().isEmpty());

        var threeLevels = new RenderContext(new ComponentRegistry());
        assertEquals("", new RenderEngine(threeLevels, 2, false)
            .render(Elements.fragment(Elements.fragment(Elements.fragment("leaf")))));
        assertEquals(RenderError.MAX_DEPTH_EXCEEDED, threeLevels.errors().get(0).code());
    }

    @Test
    void selfContainingPropsAreCutAndReported() {
        var context = new RenderContext(new ComponentRegistry());
        var probe = new SampleComponents.Probe();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "loop");
        data.put("self", data);
        List<Object> items = new ArrayList<>();
        items.add("a");
        items.add(items);

        String text = render(Elements.fragment(Elements.element(probe, Elements.props("data", data, "items", items)), "done"), context);

        assertEquals("done", text);
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("name", "loop");
        expected.put("self", null);
        assertEquals(expected, probe.seen.get(0).get("data"));
        assertEquals(Arrays.asList("a", null), probe.seen.get(0).get("items"));
        assertEquals(List.of(RenderError.CIRCULAR_REFERENCE, RenderError.CIRCULAR_REFERENCE),
            context.errors().stream().map(RenderError::code).toList());
    }

    @Test
    void selfContainingChildrenRenderTheirItemsOnce() {
        var context = new RenderContext(new ComponentRegistry());
        List<Object> children = new ArrayList<>();
        children.add("a");
        children.add(children);
        children.add("b");

        assertEquals("ab", render(Elements.fragment(children), context));
    }

    @Test
    void repeatedResolvableElementPrintsItsResolvedValue() {
        var context = new RenderContext(new ComponentRegistry());
        var counter = new SampleComponents.Counter("blue");
        var element = Elements.element(counter);

        assertEquals("[blue] blue", render(Elements.fragment(element, " ", element), context));
        assertEquals(1, counter.resolves);
    }

    @Test
    void scopesAreVisibleToDescendantsOnly() {
        var context = new RenderContext(new ComponentRegistry());
        var opener = new SampleComponents.ScopeOpener();
        var reader = new SampleComponents.ScopeReader();
        var tree = Elements.fragment(
            Elements.element(opener, Elements.props("name", "outer", "tone", "formal"),
                Elements.element(opener, Elements.props("name", "inner", "tone", "casual"), Elements.element(reader)),
                " ",
                Elements.element(reader)),
            " ",
            Elements.element(reader)
        );

        assertEquals("outer/inner:casual outer:formal none", render(tree, context));
        assertNull(context.scope());
    }

    @Test
    void indentedOutputPrefixesNonBlankLines() {
        var context = new RenderContext(new ComponentRegistry());

        assertEquals("  a\n  b\n\n  c", render(new Indented("  ", List.of("a\nb\n\nc")), context));
    }

    @Test
    void seedAnswerNeverOverwrites() {
        var context = new RenderContext(new ComponentRegistry());

        assertEquals("first", context.seedAnswer("x", "first"));
        assertEquals("first", context.seedAnswer("x", "second"));
        assertSame(context.answers(), context.answers());
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new RenderEngine(new RenderContext(new ComponentRegistry()), 0, false));
    }
}

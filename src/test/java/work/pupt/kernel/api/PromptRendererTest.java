package work.pupt.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.core.structural.Prompt;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Elements;
import work.pupt.kernel.runtime.RenderError;

class PromptRendererTest {
    private final PromptRenderer renderer = new PromptRenderer();

    private Element el(String type, Map<String, Object> props, Object... children) {
        return Elements.element(renderer.registry().get(type), props, children);
    }

    @Test
    void silentConfirmSeedsTheAnswerSeenByLaterConditions() {
        var tree = Elements.fragment(
            el("Ask.Confirm", Elements.props("name", "x", "default", false, "silent", true)),
            el("If", Elements.props("formula", "NOT(x)"), "A"),
            el("If", Elements.props("formula", "x"), "B")
        );

        var result = renderer.render(tree);

        assertTrue(result.ok());
        assertEquals("A", result.text());
        assertEquals(Map.of("x", false), result.answers());
    }

    @Test
    void callerAnswersAreCopiedNotMutated() {
        var seeded = new HashMap<String, Object>();
        seeded.put("x", true);
        var tree = Elements.fragment(
            el("Ask.Text", Elements.props("name", "y", "default", "fresh", "silent", true)),
            el("If", Elements.props("when", "=x"), "B"));

        var result = renderer.render(tree, RenderOptions.builder().answers(seeded).build());

        assertEquals("B", result.text());
        assertEquals(Map.of("x", true), seeded);
        assertEquals(Map.of("x", true, "y", "fresh"), result.answers());
    }

    @Test
    void failingSiblingDoesNotStopTheRest() {
        var tree = Elements.fragment(
            el("Task", Elements.props("delimiter", "none"), "first"),
            el("Constraint", Elements.props("type", 5), "raw"),
            el("Task", Elements.props("delimiter", "none"), "last")
        );

        var result = renderer.render(tree);

        assertFalse(result.ok());
        assertEquals(RenderResult.Status.FAILURE, result.status());
        assertEquals(1, result.errors().size());
        assertEquals("Constraint", result.errors().get(0).component());
        assertEquals("first\nrawlast", result.text());
    }

    @Test
    void warningsDoNotFailTheRenderByDefault() {
        var prompt = el("Prompt", Elements.props("name", "p"), "Body");

        var result = renderer.render(prompt);

        assertTrue(result.ok());
        assertEquals(List.of(Prompt.WARN_MISSING_TASK),
            result.warnings().stream().map(RenderError::code).toList());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void warningsCanBePromotedOrIgnored() {
        var prompt = el("Prompt", Elements.props("name", "p"), "Body");

        var strict = renderer.render(prompt, RenderOptions.builder().throwOnWarnings(true).build());
        var quiet = renderer.render(prompt, RenderOptions.builder()
            .throwOnWarnings(true)
            .ignoreWarnings(Set.of(Prompt.WARN_MISSING_TASK))
            .build());

        assertFalse(strict.ok());
        assertEquals(Prompt.WARN_MISSING_TASK, strict.errors().get(0).code());
        assertEquals("Body", strict.text());
        assertTrue(quiet.ok());
        assertTrue(quiet.warnings().isEmpty());
    }

    @Test
    void trimCanBeDisabled() {
        var task = el("Task", Elements.props(), "x");

        assertEquals("<task>\nx\n</task>\n", renderer.render(task, RenderOptions.builder().trim(false).build()).text());
    }

    @Test
    void strictValidationRequiresSchemas() {
        var registry = renderer.registry().copy();
        registry.register("Bare", (props, resolved, context) -> "bare");
        var custom = new PromptRenderer(registry);
        var tree = Elements.element(registry.get("Bare"), Elements.props(), "fallback");

        assertEquals("bare", custom.render(tree).text());
        var strict = custom.render(tree, RenderOptions.builder().strictValidation(true).build());
        assertFalse(strict.ok());
        assertEquals(RenderError.MISSING_SCHEMA, strict.errors().get(0).code());
        assertEquals("fallback", strict.text());
    }

    @Test
    void jsonOutputListsErrorsOnlyOnFailure() {
        var ok = renderer.renderToJson(el("Task", Elements.props(), "x"), RenderOptions.defaults());
        var failed = renderer.render(el("Ask.Text", Elements.props())).toSerializableMap();

        assertTrue(ok.contains("\"ok\" : true"), ok);
        assertFalse(ok.contains("\"errors\""), ok);
        assertEquals(false, failed.get("ok"));
        assertTrue(failed.containsKey("errors"));
    }

    @Test
    void failureRequiresAnError() {
        assertThrows(IllegalArgumentException.class,
            () -> RenderResult.failure("", List.of(), List.of(), List.of(), List.of(), Map.of()));
        assertEquals(1, RenderResult.Status.FAILURE.exitCode());
        assertEquals(0, RenderResult.Status.SUCCESS.exitCode());
    }

    @Test
    void optionsRejectNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> RenderOptions.builder().maxDepth(0).build());
        assertEquals(OutputFormat.MARKDOWN, OutputFormat.from("md"));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.from("html"));
    }
}

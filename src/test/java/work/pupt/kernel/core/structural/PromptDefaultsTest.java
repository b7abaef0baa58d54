package work.pupt.kernel.core.structural;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.api.PromptRenderer;
import work.pupt.kernel.api.RenderOptions;
import work.pupt.kernel.api.RenderResult;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Elements;
import work.pupt.kernel.runtime.EnvironmentFacts;
import work.pupt.kernel.runtime.EnvironmentFacts.PromptDefaults;
import work.pupt.kernel.runtime.RenderError;

class PromptDefaultsTest {
    private static final PromptRenderer RENDERER = new PromptRenderer();
    private static final RenderOptions ALL_DEFAULTS = RenderOptions.builder()
        .environment(EnvironmentFacts.defaults().withPrompt(PromptDefaults.all()))
        .build();
    private static final String ASSISTANT = "You are a helpful Assistant. You have expertise in general help.";
    private static final String CONSTRAINTS = "- Keep responses concise and focused\n"
        + "- Be accurate and do not make up information\n"
        + "- Acknowledge uncertainty when you are not sure";

    private static Element el(String type, Map<String, Object> props, Object... children) {
        return Elements.element(RENDERER.registry().get(type), props, children);
    }

    private static Element prompt(Map<String, Object> props) {
        return el("Prompt", props, el("Task", Elements.props(), "Go"));
    }

    private static String render(Element root, RenderOptions options) {
        RenderResult result = RENDERER.render(root, options);
        assertTrue(result.ok(), () -> "unexpected errors " + result.errors());
        return result.text();
    }

    @Test
    void environmentTurnsOnEveryDefaultSection() {
        String text = render(prompt(Elements.props("name", "p")), ALL_DEFAULTS);

        assertEquals(
            "<role>\n" + ASSISTANT + "\n</role>\n"
                + "<task>\nGo\n</task>\n"
                + "<format>\nOutput format: xml\n</format>\n"
                + "<constraints>\n" + CONSTRAINTS + "\n</constraints>",
            text);
    }

    @Test
    void defaultSectionsAreOffUnlessAsked() {
        assertEquals("<task>\nGo\n</task>", render(prompt(Elements.props("name", "p")), RenderOptions.defaults()));

        String roleOnly = render(prompt(Elements.props("name", "p", "defaults", Map.of("role", true))),
            RenderOptions.defaults());
        assertEquals("<role>\n" + ASSISTANT + "\n</role>\n<task>\nGo\n</task>", roleOnly);
    }

    @Test
    void shorthandsMatchTheDefaultsMap() {
        String noRole = render(prompt(Elements.props("name", "p", "noRole", true)), ALL_DEFAULTS);
        String viaMap = render(prompt(Elements.props("name", "p", "defaults", Map.of("role", false))), ALL_DEFAULTS);

        assertEquals(viaMap, noRole);
        assertFalse(noRole.contains("Assistant"));
        assertTrue(noRole.contains("concise"));

        String noFormat = render(prompt(Elements.props("name", "p", "noFormat", true)), ALL_DEFAULTS);
        assertFalse(noFormat.contains("Output format"));
        assertTrue(noFormat.contains("Assistant"));

        String noConstraints = render(prompt(Elements.props("name", "p", "noConstraints", true)), ALL_DEFAULTS);
        assertFalse(noConstraints.contains("concise"));
    }

    @Test
    void defaultsNoneIsTheSameAsBare() {
        String none = render(prompt(Elements.props("name", "p", "defaults", "none")), ALL_DEFAULTS);
        String bare = render(prompt(Elements.props("name", "p", "bare", true)), ALL_DEFAULTS);

        assertEquals("<task>\nGo\n</task>", none);
        assertEquals(bare, none);
    }

    @Test
    void rolePresetsFollowTheProvider() {
        var google = RenderOptions.builder()
            .environment(EnvironmentFacts.defaults()
                .withLlm(EnvironmentFacts.Llm.defaults().withProvider("Google"))
                .withPrompt(PromptDefaults.all()))
            .build();

        String text = render(prompt(Elements.props("name", "p", "role", "engineer", "noConstraints", true)), google);

        assertEquals(
            "<role>\nYour role: a helpful Software Engineer. You have expertise in software development, "
                + "programming, system design.\n</role>\n"
                + "<task>\nGo\n</task>\n"
                + "<format>\nOutput format: markdown\n</format>",
            text);
        assertTrue(render(prompt(Elements.props("name", "p", "role", "engineer", "expertise", "Kafka")),
            RenderOptions.defaults()).contains("Software Engineer. You have expertise in Kafka."));
    }

    @Test
    void explicitSectionsSuppressTheirDefaults() {
        var tree = el("Prompt", Elements.props("name", "p"),
            el("Role", Elements.props("title", "reviewer")),
            el("Task", Elements.props(), "Go"),
            el("Format", Elements.props("type", "json")),
            el("Constraint", Elements.props(), "Cite sources"));

        String text = render(tree, ALL_DEFAULTS);

        assertEquals(1, text.split("<role>", -1).length - 1);
        assertFalse(text.contains("Assistant"));
        assertFalse(text.contains("Output format: xml"));
        assertFalse(text.contains("concise"));
        assertTrue(text.contains("MUST: Cite sources"));
    }

    @Test
    void constraintsContainerReplacesOrExtendsTheDefaults() {
        var replacing = el("Prompt", Elements.props("name", "p"),
            el("Task", Elements.props(), "Go"),
            el("Constraints", Elements.props(), el("Constraint", Elements.props(), "Cite sources")));
        var extending = el("Prompt", Elements.props("name", "p"),
            el("Task", Elements.props(), "Go"),
            el("Constraints", Elements.props("extend", true, "exclude", List.of("CONCISE")),
                el("Constraint", Elements.props(), "Cite sources")));

        String replaced = render(replacing, ALL_DEFAULTS);
        String extended = render(extending, ALL_DEFAULTS);

        assertTrue(replaced.contains("MUST: Cite sources"));
        assertFalse(replaced.contains("- Be accurate"));
        assertTrue(extended.contains("MUST: Cite sources"));
        assertTrue(extended.contains("- Be accurate and do not make up information"));
        assertFalse(extended.contains("concise"));
    }

    @Test
    void strictFormatWithVisibleReasoningWarns() {
        var conflicting = el("Prompt", Elements.props("name", "p"),
            el("Task", Elements.props(), "Go"),
            el("Format", Elements.props("strict", true)),
            el("ChainOfThought", Elements.props()));
        var hidden = el("Prompt", Elements.props("name", "p"),
            el("Task", Elements.props(), "Go"),
            el("Format", Elements.props("strict", true)),
            el("ChainOfThought", Elements.props("showReasoning", false)));

        RenderResult warned = RENDERER.render(conflicting);
        RenderResult quiet = RENDERER.render(hidden);
        RenderResult promoted = RENDERER.render(conflicting, RenderOptions.builder().throwOnWarnings(true).build());

        assertTrue(warned.ok());
        assertEquals(List.of(Prompt.WARN_CONFLICTING_INSTRUCTIONS),
            warned.warnings().stream().map(RenderError::code).toList());
        assertTrue(quiet.warnings().isEmpty());
        assertFalse(promoted.ok());
    }
}

package work.pupt.kernel.core.post;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.api.PromptRenderer;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Elements;
import work.pupt.kernel.runtime.PostExecutionAction;
import work.pupt.kernel.runtime.RenderError;

class PostExecutionComponentsTest {
    private static final PromptRenderer RENDERER = new PromptRenderer();

    private static Element el(String type, Map<String, Object> props, Object... children) {
        return Elements.element(RENDERER.registry().get(type), props, children);
    }

    @Test
    void actionsAreCollectedInDocumentOrder() {
        var tree = Elements.fragment(
            "Prompt text",
            el("PostExecution", Elements.props(),
                el("ReviewFile", Elements.props("file", "out.md", "editor", "vim")),
                el("OpenUrl", Elements.props("url", "https://example.com")),
                el("RunCommand", Elements.props("command", "make", "cwd", "/tmp", "env", Map.of("CI", true))))
        );

        var result = RENDERER.render(tree);

        assertTrue(result.ok());
        assertEquals("Prompt text", result.text());
        assertEquals(List.of(
            new PostExecutionAction.ReviewFile("out.md", "vim"),
            new PostExecutionAction.OpenUrl("https://example.com", null),
            new PostExecutionAction.RunCommand("make", "/tmp", Map.of("CI", "true"))
        ), result.postExecution());
    }

    @Test
    void actionsSerializeWithTheirType() {
        var result = RENDERER.render(el("OpenUrl", Elements.props("url", "https://example.com", "browser", "firefox")));

        @SuppressWarnings("unchecked")
        var actions = (List<Map<String, Object>>) result.toSerializableMap().get("postExecution");

        assertEquals(List.of(Map.of("type", "openUrl", "url", "https://example.com", "browser", "firefox")), actions);
    }

    @Test
    void invalidActionIsNotRecorded() {
        var result = RENDERER.render(el("ReviewFile", Elements.props()));

        assertFalse(result.ok());
        assertEquals("file", result.errors().get(0).prop());
        assertEquals(RenderError.INVALID_TYPE, result.errors().get(0).code());
        assertTrue(result.postExecution().isEmpty());
    }
}

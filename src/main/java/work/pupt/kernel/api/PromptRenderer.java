package work.pupt.kernel.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.pupt.kernel.core.BuiltinComponents;
import work.pupt.kernel.runtime.ComponentRegistry;
import work.pupt.kernel.runtime.EnvironmentFacts;
import work.pupt.kernel.runtime.RenderContext;
import work.pupt.kernel.runtime.RenderEngine;
import work.pupt.kernel.runtime.RenderError;

/**
 * Entry point for rendering element trees (usable by the CLI and embedding apps).
 *
 * <p>Each call builds a fresh {@link RenderContext}; a renderer instance keeps no per-render state
 * and can be shared.
 */
public final class PromptRenderer {
    private static final Logger log = LoggerFactory.getLogger(PromptRenderer.class);

    private final ComponentRegistry registry;

    public PromptRenderer() {
        this(BuiltinComponents.create());
    }

    public PromptRenderer(ComponentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public RenderResult render(Object root) {
        return render(root, RenderOptions.defaults());
    }

    /**
     * Renders {@code root}, which may be an element built by any loaded copy of this library.
     */
    public RenderResult render(Object root, RenderOptions options) {
        Objects.requireNonNull(options, "options");
        EnvironmentFacts env = options.environment()
            .withOutput(new EnvironmentFacts.Output(options.format(), options.trim(), options.indent()));
        if (env.runtime() == null) {
            env = env.withRuntime(EnvironmentFacts.RuntimeFacts.capture());
        }
        Map<String, Object> answers = new LinkedHashMap<>(options.answers());
        var context = new RenderContext(registry, env, answers, options.answerSource());

        String text = new RenderEngine(context, options.maxDepth(), options.strictValidation()).render(root);
        if (options.trim()) {
            text = text.strip();
        }

        List<RenderError> errors = new ArrayList<>();
        List<RenderError> warnings = new ArrayList<>();
        for (RenderError error : context.errors()) {
            if (!error.isWarning()) {
                errors.add(error);
            } else if (options.ignoreWarnings().contains(error.code())) {
                log.debug("Ignoring warning {}", error);
            } else if (options.throwOnWarnings()) {
                errors.add(error);
            } else {
                warnings.add(error);
            }
        }

        if (errors.isEmpty()) {
            return RenderResult.success(text, warnings, context.postExecution(), context.requirements(), answers);
        }
        log.debug("Render finished with {} error(s)", errors.size());
        return RenderResult.failure(text, errors, warnings, context.postExecution(), context.requirements(), answers);
    }

    public String renderToJson(Object root, RenderOptions options) {
        return render(root, options).toPrettyJson();
    }
}

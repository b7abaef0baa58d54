package work.pupt.kernel.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state threaded through one render call. Never shared between renders.
 */
public final class RenderContext {
    private final ComponentRegistry registry;
    private final EnvironmentFacts env;
    private final Map<String, Object> answers;
    private final AnswerSource answerSource;
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final List<PostExecutionAction> postExecution = new ArrayList<>();
    private final List<RenderError> errors = new ArrayList<>();
    private final List<InputRequirement> requirements = new ArrayList<>();
    private final Map<String, Object> attributes = new HashMap<>();

    public RenderContext(ComponentRegistry registry) {
        this(registry, EnvironmentFacts.defaults(), new LinkedHashMap<>(), AnswerSource.NONE);
    }

    public RenderContext(
        ComponentRegistry registry,
        EnvironmentFacts env,
        Map<String, Object> answers,
        AnswerSource answerSource
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.env = env == null ? EnvironmentFacts.defaults() : env;
        this.answers = answers == null ? new LinkedHashMap<>() : answers;
        this.answerSource = answerSource == null ? AnswerSource.NONE : answerSource;
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public EnvironmentFacts env() {
        return env;
    }

    /**
     * Live answers map. Interactive components write to it with {@link #seedAnswer}.
     */
    public Map<String, Object> answers() {
        return answers;
    }

    public Object answer(String name) {
        return answers.get(name);
    }

    public boolean hasAnswer(String name) {
        return answers.get(name) != null;
    }

    /**
     * Writes {@code value} only when {@code name} has no answer yet and returns the answer in effect.
     */
    public Object seedAnswer(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (answers.get(name) == null && value != null) {
            answers.put(name, value);
        }
        return answers.get(name);
    }

    public Optional<Object> requestAnswer(InputRequirement requirement) throws Exception {
        Optional<Object> supplied = answerSource.answer(requirement);
        return supplied == null ? Optional.empty() : supplied;
    }

    public Scope scope() {
        return scopes.peek();
    }

    void pushScope(Scope scope) {
        scopes.push(scope);
    }

    void popScope() {
        scopes.pop();
    }

    public void addPostExecution(PostExecutionAction action) {
        postExecution.add(Objects.requireNonNull(action, "action"));
    }

    public List<PostExecutionAction> postExecution() {
        return Collections.unmodifiableList(postExecution);
    }

    public void addError(RenderError error) {
        errors.add(Objects.requireNonNull(error, "error"));
    }

    public List<RenderError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public void addRequirement(InputRequirement requirement) {
        requirements.add(Objects.requireNonNull(requirement, "requirement"));
    }

    public List<InputRequirement> requirements() {
        return Collections.unmodifiableList(requirements);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }
}

package work.pupt.kernel.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.pupt.kernel.element.DeferredRef;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Identity;
import work.pupt.kernel.element.Nodes;
import work.pupt.kernel.schema.PropSchema;
import work.pupt.kernel.schema.PropValidator;

/**
 * Two-phase walk over an element tree: materialize props, validate, resolve, then render.
 *
 * <p>One engine serves one render call. Resolved values are memoized by element identity, so an
 * element referenced from several props resolves exactly once. Problems are recorded in the
 * context and the failing node falls back to rendering its children.
 */
public final class RenderEngine {
    private static final Logger log = LoggerFactory.getLogger(RenderEngine.class);

    private final RenderContext context;
    private final int maxDepth;
    private final boolean strictValidation;

    private final Map<Element, Evaluation> evaluations = new IdentityHashMap<>();
    private final Set<Element> resolving = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Element> rendered = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Object, Element> adopted = new IdentityHashMap<>();

    public RenderEngine(RenderContext context, int maxDepth, boolean strictValidation) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.context = context;
        this.maxDepth = maxDepth;
        this.strictValidation = strictValidation;
    }

    public RenderContext context() {
        return context;
    }

    public String render(Object root) {
        log.debug("Rendering {}", root);
        StringBuilder out = new StringBuilder();
        renderNode(root, 0, out);
        log.debug("Rendered {} chars with {} error(s)", out.length(), context.errors().size());
        return out.toString();
    }

    private void renderNode(Object node, int depth, StringBuilder out) {
        if (node == null || node instanceof Boolean) {
            return;
        }
        if (node instanceof CharSequence || node instanceof Number || node instanceof Character) {
            out.append(Nodes.stringify(node));
            return;
        }
        if (node instanceof Collection<?> || node instanceof Object[]) {
            for (Object child : Nodes.flatten(node)) {
                renderNode(child, depth, out);
            }
            return;
        }
        if (node instanceof Scoped scoped) {
            renderScoped(scoped, depth, out);
            return;
        }
        if (node instanceof Indented indented) {
            renderIndented(indented, depth, out);
            return;
        }
        if (node instanceof DeferredRef ref) {
            out.append(Nodes.stringify(resolveReference(ref, depth)));
            return;
        }
        Element element = asElement(node);
        if (element != null) {
            renderElement(element, depth, out);
            return;
        }
        out.append(node);
    }

    private void renderScoped(Scoped scoped, int depth, StringBuilder out) {
        Scope parent = context.scope();
        Scope scope = parent == null
            ? Scope.root(scoped.name(), scoped.values())
            : parent.child(scoped.name(), scoped.values());
        context.pushScope(scope);
        try {
            renderNode(scoped.children(), depth, out);
        } finally {
            context.popScope();
        }
    }

    private void renderIndented(Indented indented, int depth, StringBuilder out) {
        StringBuilder inner = new StringBuilder();
        renderNode(indented.children(), depth, inner);
        String indent = indented.indent();
        if (indent == null || indent.isEmpty()) {
            out.append(inner);
            return;
        }
        String[] lines = inner.toString().split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            if (!lines[i].isBlank()) {
                out.append(indent);
            }
            out.append(lines[i]);
        }
    }

    private void renderElement(Element element, int depth, StringBuilder out) {
        if (depth >= maxDepth) {
            record(RenderError.of(element.typeName(), RenderError.MAX_DEPTH_EXCEEDED,
                "Maximum render depth of " + maxDepth + " exceeded"));
            return;
        }
        if (element.isFragment()) {
            renderNode(element.children(), depth + 1, out);
            return;
        }
        if (element.isText()) {
            out.append(Nodes.stringify(element.props().get("value")));
            renderNode(element.children(), depth + 1, out);
            return;
        }
        Component component = componentOf(element);
        if (component == null) {
            renderNode(element.children(), depth + 1, out);
            return;
        }
        // A resolvable element that appears again prints its resolved value.
        if (component instanceof Resolvable && rendered.contains(element)) {
            Evaluation previous = evaluations.get(element);
            if (previous != null && !previous.failed()) {
                out.append(Nodes.stringify(previous.resolved()));
                return;
            }
        }
        Evaluation evaluation = evaluate(element, component, depth);
        rendered.add(element);
        if (evaluation.failed()) {
            renderNode(element.children(), depth + 1, out);
            return;
        }
        Object produced;
        try {
            produced = component.render(evaluation.props(), evaluation.resolved(), context);
        } catch (Exception ex) {
            log.debug("Render of {} failed", component.name(), ex);
            record(RenderError.runtime(component.name(), ex));
            renderNode(element.children(), depth + 1, out);
            return;
        }
        renderNode(produced, depth + 1, out);
    }

    private Evaluation evaluate(Element element, Component component, int depth) {
        Evaluation existing = evaluations.get(element);
        if (existing != null) {
            return existing;
        }
        if (!resolving.add(element)) {
            record(RenderError.of(component.name(), RenderError.CIRCULAR_REFERENCE,
                "Circular reference while resolving " + component.name()));
            return Evaluation.FAILED;
        }
        try {
            Evaluation evaluation = evaluateOnce(element, component, depth);
            evaluations.put(element, evaluation);
            return evaluation;
        } finally {
            resolving.remove(element);
        }
    }

    private Evaluation evaluateOnce(Element element, Component component, int depth) {
        Map<String, Object> materialized = materializeProps(component.name(), element.props(), depth);
        Props props = new Props(materialized, element.children());

        PropSchema schema = component.schema();
        if (schema == null) {
            if (strictValidation) {
                record(RenderError.of(component.name(), RenderError.MISSING_SCHEMA,
                    "Component " + component.name() + " does not declare a schema"));
                return new Evaluation(props, null, true);
            }
        } else {
            List<RenderError> problems = PropValidator.validate(component.name(), materialized, schema);
            if (!problems.isEmpty()) {
                problems.forEach(this::record);
                return new Evaluation(props, null, true);
            }
        }

        if (!(component instanceof Resolvable resolvable)) {
            return new Evaluation(props, null, false);
        }
        try {
            return new Evaluation(props, resolvable.resolve(props, context), false);
        } catch (Exception ex) {
            log.debug("Resolve of {} failed", component.name(), ex);
            record(RenderError.runtime(component.name(), ex));
            return new Evaluation(props, null, true);
        }
    }

    private Map<String, Object> materializeProps(String owner, Map<String, Object> props, int depth) {
        Set<Object> open = Collections.newSetFromMap(new IdentityHashMap<>());
        Map<String, Object> out = new LinkedHashMap<>();
        for (var entry : props.entrySet()) {
            out.put(entry.getKey(), materialize(owner, entry.getValue(), depth, open));
        }
        return out;
    }

    /**
     * Copies {@code value} with element references replaced by their resolved values. A list or
     * map that contains itself is cut at the repeat and recorded as a circular reference.
     */
    private Object materialize(String owner, Object value, int depth, Set<Object> open) {
        if (value == null) {
            return null;
        }
        if (value instanceof DeferredRef ref) {
            return resolveReference(ref, depth);
        }
        Element element = asElement(value);
        if (element != null) {
            return resolvedValueOf(element, depth);
        }
        if (!(value instanceof List<?>) && !(value instanceof Map<?, ?>)) {
            return value;
        }
        if (!open.add(value)) {
            record(RenderError.of(owner, RenderError.CIRCULAR_REFERENCE,
                "Prop value of " + owner + " contains itself"));
            return null;
        }
        try {
            if (value instanceof List<?> list) {
                List<Object> copy = new ArrayList<>(list.size());
                for (Object item : list) {
                    copy.add(materialize(owner, item, depth, open));
                }
                return copy;
            }
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (var entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), materialize(owner, entry.getValue(), depth, open));
            }
            return copy;
        } finally {
            open.remove(value);
        }
    }

    private Object resolveReference(DeferredRef ref, int depth) {
        Object base = resolvedValueOf(ref.element(), depth);
        return Nodes.followPath(base, ref.path());
    }

    private Object resolvedValueOf(Element element, int depth) {
        if (depth + 1 >= maxDepth) {
            record(RenderError.of(element.typeName(), RenderError.MAX_DEPTH_EXCEEDED,
                "Maximum render depth of " + maxDepth + " exceeded"));
            return null;
        }
        if (element.isFragment() || element.isText()) {
            return null;
        }
        Component component = componentOf(element);
        if (component == null) {
            return null;
        }
        Evaluation evaluation = evaluate(element, component, depth + 1);
        return evaluation.failed() ? null : evaluation.resolved();
    }

    private Component componentOf(Element element) {
        Component local = element.component();
        if (local != null) {
            return local;
        }
        String name = Identity.componentName(element.type());
        Component found = context.registry().get(name);
        if (found == null) {
            String message = local == null && Identity.isComponent(element.type())
                ? "Component " + name + " comes from another class loader and is not registered locally"
                : "Unknown component type: " + element.typeName();
            record(RenderError.of(element.typeName(), RenderError.UNKNOWN_COMPONENT, message));
        }
        return found;
    }

    private Element asElement(Object value) {
        if (value instanceof Element element) {
            return element;
        }
        if (!Identity.isElement(value)) {
            return null;
        }
        return Identity.adopt(value, adopted);
    }

    private void record(RenderError error) {
        log.debug("Recorded {}", error);
        context.addError(error);
    }

    private record Evaluation(Props props, Object resolved, boolean failed) {
        static final Evaluation FAILED = new Evaluation(new Props(Map.of(), List.of()), null, true);
    }
}

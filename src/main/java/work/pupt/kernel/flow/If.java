package work.pupt.kernel.flow;

import java.util.List;
import java.util.Locale;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.formula.FormulaEvaluator;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;
import work.pupt.kernel.runtime.Resolvable;

/**
 * Renders its children only when every given condition holds.
 *
 * <ul>
 *   <li>{@code when}: a boolean, or a formula string starting with {@code =}; other strings are true
 *       when non-empty</li>
 *   <li>{@code formula}: a formula, with or without the leading {@code =}</li>
 *   <li>{@code provider} / {@code notProvider}: LLM provider name(s) matched against the environment</li>
 * </ul>
 */
public final class If extends BuiltinComponent implements Resolvable {
    private static final List<String> CONDITIONS = List.of("when", "formula", "provider", "notProvider");

    public If() {
        super("If");
    }

    @Override
    public Object resolve(Props props, RenderContext context) {
        if (CONDITIONS.stream().noneMatch(props.asMap()::containsKey)) {
            throw new IllegalArgumentException("If requires one of " + CONDITIONS);
        }
        boolean pass = true;
        if (props.asMap().containsKey("when")) {
            Object when = props.get("when");
            pass = when instanceof String text && !FormulaEvaluator.isFormula(text)
                ? !text.isEmpty()
                : FormulaEvaluator.condition(when, context.answers());
        }
        if (pass && props.has("formula")) {
            pass = FormulaEvaluator.evaluate(props.string("formula"), context.answers());
        }
        String provider = normalize(context.env().llm().provider());
        if (pass && props.has("provider")) {
            pass = props.strings("provider").stream().map(If::normalize).anyMatch(provider::equals);
        }
        if (pass && props.has("notProvider")) {
            pass = props.strings("notProvider").stream().map(If::normalize).noneMatch(provider::equals);
        }
        return pass;
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        return Boolean.TRUE.equals(resolved) ? props.children() : null;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

package work.pupt.kernel.core.structural;

import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Single rule, prefixed by its strength ({@code must}, {@code should}, {@code must-not}, {@code may}).
 */
public final class Constraint extends BuiltinComponent {
    public Constraint() {
        super("Constraint");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String prefix = switch (props.string("type", "must")) {
            case "should" -> "SHOULD: ";
            case "must-not" -> "MUST NOT: ";
            case "may" -> "MAY: ";
            default -> "MUST: ";
        };
        return Delimiters.wrap("constraint", List.of(prefix, props.children()), Delimiters.style(props, context), context);
    }
}

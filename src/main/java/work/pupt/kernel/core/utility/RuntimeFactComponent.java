package work.pupt.kernel.core.utility;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.EnvironmentFacts.RuntimeFacts;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Renders one of the runtime facts captured for the current render.
 */
abstract class RuntimeFactComponent extends BuiltinComponent {
    RuntimeFactComponent(String name) {
        super(name);
    }

    @Override
    public final Object render(Props props, Object resolved, RenderContext context) {
        RuntimeFacts facts = context.env().runtime();
        return fact(facts != null ? facts : RuntimeFacts.capture(), props);
    }

    abstract Object fact(RuntimeFacts facts, Props props);
}

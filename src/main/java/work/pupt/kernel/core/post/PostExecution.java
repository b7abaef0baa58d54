package work.pupt.kernel.core.post;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Groups post-execution actions. Contributes no text of its own.
 */
public final class PostExecution extends BuiltinComponent {
    public PostExecution() {
        super("PostExecution");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        return props.children();
    }
}

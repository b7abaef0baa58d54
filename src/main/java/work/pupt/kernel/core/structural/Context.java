package work.pupt.kernel.core.structural;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class Context extends BuiltinComponent {
    public Context() {
        super("Context");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        return Delimiters.wrap("context", props.children(), Delimiters.style(props, context), context);
    }
}

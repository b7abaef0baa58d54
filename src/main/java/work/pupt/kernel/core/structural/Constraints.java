package work.pupt.kernel.core.structural;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class Constraints extends BuiltinComponent {
    public Constraints() {
        super("Constraints");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        return Delimiters.wrap("constraints", props.children(), Delimiters.style(props, context), context);
    }
}

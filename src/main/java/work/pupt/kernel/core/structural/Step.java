package work.pupt.kernel.core.structural;

import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class Step extends BuiltinComponent {
    public Step() {
        super("Step");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        if (props.has("number")) {
            return List.of(props.integer("number", 1) + ". ", props.children(), "\n");
        }
        return List.of(props.children(), "\n");
    }
}

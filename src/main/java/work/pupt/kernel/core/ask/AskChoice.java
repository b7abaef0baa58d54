package work.pupt.kernel.core.ask;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Marker child read by its parent input ({@code Ask.Option}, {@code Ask.Label}). Renders nothing.
 */
public class AskChoice extends BuiltinComponent {
    protected AskChoice(String name) {
        super(name);
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        return null;
    }
}

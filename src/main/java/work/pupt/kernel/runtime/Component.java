package work.pupt.kernel.runtime;

import work.pupt.kernel.element.GlobalSymbols;
import work.pupt.kernel.schema.PropSchema;

/**
 * A renderable building block. Implementations are stateless; everything that changes during a
 * render lives in the {@link RenderContext}.
 */
public interface Component {
    String COMPONENT_MARKER = GlobalSymbols.COMPONENT_KEY;

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Schema used to validate materialized props, or {@code null} when the component declares none.
     */
    default PropSchema schema() {
        return null;
    }

    Object render(Props props, Object resolved, RenderContext context) throws Exception;
}

package work.pupt.kernel.core.structural;

import java.util.LinkedHashMap;
import java.util.Map;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;
import work.pupt.kernel.runtime.Scoped;

/**
 * Named block. A {@code delimiter} prop becomes the default for everything inside it.
 */
public final class Section extends BuiltinComponent {
    public Section() {
        super("Section");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String tag = props.string("name", "section");
        Map<String, Object> scopeValues = new LinkedHashMap<>();
        if (props.has(Delimiters.SCOPE_KEY)) {
            scopeValues.put(Delimiters.SCOPE_KEY, props.string(Delimiters.SCOPE_KEY));
        }
        Object wrapped = Delimiters.wrap(tag, props.children(), Delimiters.style(props, context), context);
        return Scoped.within(tag, scopeValues, wrapped);
    }
}

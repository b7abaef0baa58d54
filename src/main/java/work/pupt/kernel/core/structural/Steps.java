package work.pupt.kernel.core.structural;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Nodes;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Numbered list of {@link Step} children. Other children are rendered as they are.
 */
public final class Steps extends BuiltinComponent {
    public Steps() {
        super("Steps");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        List<Object> content = new ArrayList<>();
        int number = props.integer("start", 1);
        for (Object child : Nodes.flatten(props.children())) {
            if (child instanceof Element element && element.component() instanceof Step) {
                content.add(number++ + ". ");
                content.add(element.children());
                content.add("\n");
            } else {
                content.add(child);
            }
        }
        return Delimiters.wrap("steps", content, Delimiters.style(props, context), context);
    }
}

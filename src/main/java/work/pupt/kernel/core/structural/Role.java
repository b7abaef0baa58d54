package work.pupt.kernel.core.structural;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class Role extends BuiltinComponent {
    public Role() {
        super("Role");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        Object content = props.children();
        if (props.children().isEmpty()) {
            StringBuilder text = new StringBuilder("You are a ").append(props.string("title", "helpful assistant"));
            if (props.has("expertise")) {
                text.append(" with expertise in ").append(props.string("expertise"));
            }
            if (props.has("domain")) {
                text.append(", specializing in ").append(props.string("domain"));
            }
            content = text.append('.').toString();
        }
        return Delimiters.wrap("role", content, Delimiters.style(props, context), context);
    }
}

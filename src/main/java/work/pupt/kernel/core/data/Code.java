package work.pupt.kernel.core.data;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Fenced code block. The language defaults to the environment's code language.
 */
public final class Code extends BuiltinComponent {
    public Code() {
        super("Code");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String language = props.string("language", context.env().code().language());
        List<Object> out = new ArrayList<>();
        if (props.has("filename")) {
            out.add("<!-- " + props.string("filename") + " -->\n");
        }
        out.add("```" + language + "\n");
        out.add(props.children());
        out.add("\n```\n");
        return out;
    }
}

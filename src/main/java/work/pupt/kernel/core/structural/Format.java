package work.pupt.kernel.core.structural;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class Format extends BuiltinComponent {
    static final String STRICT_NOTE = "Return ONLY the formatted output with no additional text or explanation.";

    public Format() {
        super("Format");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        List<Object> content = new ArrayList<>();
        if (props.has("type")) {
            content.add("Output format: " + props.string("type"));
            if (!props.children().isEmpty()) {
                content.add("\n");
            }
        }
        content.add(props.children());
        if (props.bool("strict", false)) {
            content.add("\n" + STRICT_NOTE);
        }
        return Delimiters.wrap("format", content, Delimiters.style(props, context), context);
    }
}

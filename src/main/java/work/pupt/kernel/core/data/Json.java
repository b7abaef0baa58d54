package work.pupt.kernel.core.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Embeds {@code data} as pretty-printed JSON.
 */
public final class Json extends BuiltinComponent {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public Json() {
        super("Json");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) throws Exception {
        String body = JSON_WRITER.writeValueAsString(props.get("data"));
        if (!props.bool("fenced", true)) {
            return body + "\n";
        }
        return "```json\n" + body + "\n```\n";
    }
}

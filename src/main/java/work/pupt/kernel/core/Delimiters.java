package work.pupt.kernel.core;

import java.util.Arrays;
import java.util.Locale;

import work.pupt.kernel.runtime.Indented;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;
import work.pupt.kernel.runtime.Scope;

/**
 * Wraps structural content in the active delimiter style.
 */
public final class Delimiters {
    public static final String XML = "xml";
    public static final String MARKDOWN = "markdown";
    public static final String NONE = "none";
    public static final String SCOPE_KEY = "delimiter";

    private Delimiters() {}

    /**
     * Style from the element's own {@code delimiter} prop, then the enclosing scopes, then the
     * output format.
     */
    public static String style(Props props, RenderContext context) {
        String own = props.string(SCOPE_KEY);
        if (own != null) {
            return own;
        }
        Scope scope = context.scope();
        Object inherited = scope == null ? null : scope.lookup(SCOPE_KEY);
        if (inherited != null) {
            return inherited.toString();
        }
        return context.env().output().format().delimiter();
    }

    public static Object wrap(String tag, Object content, String style, RenderContext context) {
        return switch (style) {
            case XML -> {
                String indent = context.env().output().indent();
                Object body = indent.isEmpty() ? content : new Indented(indent, content);
                yield Arrays.asList("<" + tag + ">\n", body, "\n</" + tag + ">\n");
            }
            case MARKDOWN -> Arrays.asList("## " + heading(tag) + "\n\n", content, "\n\n");
            case NONE -> Arrays.asList(content, "\n");
            default -> throw new IllegalArgumentException("Unknown delimiter style: " + style);
        };
    }

    private static String heading(String tag) {
        String words = tag.replace('-', ' ').replace('_', ' ');
        return words.isEmpty() ? words : words.substring(0, 1).toUpperCase(Locale.ROOT) + words.substring(1);
    }
}

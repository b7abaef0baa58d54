package work.pupt.kernel.core.ask;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Children;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.element.Nodes;
import work.pupt.kernel.runtime.InputRequirement;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;
import work.pupt.kernel.runtime.Resolvable;
import work.pupt.kernel.runtime.Scope;

/**
 * Interactive input. Resolving records an {@link InputRequirement}, then makes sure the answers map
 * holds a value for {@code name}: an existing answer is kept, otherwise the answer source is asked,
 * otherwise the explicit or implicit default is seeded.
 */
public abstract class AskComponent extends BuiltinComponent implements Resolvable {
    private final String inputType;

    protected AskComponent(String name, String inputType) {
        super(name);
        this.inputType = inputType;
    }

    public String inputType() {
        return inputType;
    }

    @Override
    public final Object resolve(Props props, RenderContext context) throws Exception {
        String answerName = props.string("name");
        InputRequirement requirement = requirement(props, context);
        context.addRequirement(requirement);
        if (!context.hasAnswer(answerName)) {
            Optional<Object> supplied = context.requestAnswer(requirement);
            if (supplied.isPresent()) {
                context.seedAnswer(answerName, coerce(supplied.get(), props));
            } else {
                context.seedAnswer(answerName, requirement.defaultValue());
            }
        }
        Object answer = context.answer(answerName);
        return answer == null ? null : coerce(answer, props);
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        if (props.bool("silent", false)) {
            return null;
        }
        if (resolved == null) {
            return "{" + props.string("name") + "}";
        }
        return display(resolved, props);
    }

    /**
     * Default used when neither an answer nor a {@code default} prop exists.
     */
    protected Object implicitDefault(Props props) {
        return null;
    }

    /**
     * Converts a stored answer into this input's resolved value.
     */
    protected Object coerce(Object answer, Props props) {
        return answer;
    }

    protected String display(Object resolved, Props props) {
        return Nodes.stringify(resolved);
    }

    protected List<Map<String, Object>> options(Props props) {
        return List.of();
    }

    protected Double min(Props props) {
        return props.number("min");
    }

    protected Double max(Props props) {
        return props.number("max");
    }

    private InputRequirement requirement(Props props, RenderContext context) {
        String answerName = props.string("name");
        Object explicitDefault = props.get("default");
        Scope scope = context.scope();
        return new InputRequirement(
            answerName,
            props.string("label", answerName),
            props.string("description"),
            inputType,
            props.bool("required", false),
            explicitDefault != null ? explicitDefault : implicitDefault(props),
            options(props),
            min(props),
            max(props),
            scope == null ? null : scope.path()
        );
    }

    /**
     * Reads choices from an {@code options} prop (strings or maps) and from child elements of
     * {@code childType} whose text becomes the label.
     */
    static List<Map<String, Object>> collectOptions(Props props, Class<? extends AskChoice> childType) {
        List<Map<String, Object>> options = new ArrayList<>();
        for (Object raw : props.list("options")) {
            if (raw instanceof Map<?, ?> map) {
                Object value = map.get("value");
                Object label = map.get("label") != null ? map.get("label") : map.get("text");
                options.add(option(value, label != null ? label : value));
            } else if (raw != null) {
                options.add(option(raw, raw));
            }
        }
        for (Element child : Children.ofType(props.children(), childType)) {
            Object value = child.props().get("value");
            String text = Nodes.textOf(child.children()).trim();
            Object label = child.props().get("label");
            if (label == null) {
                label = text.isEmpty() ? value : text;
            }
            options.add(option(value, label));
        }
        return options;
    }

    static String labelFor(List<Map<String, Object>> options, Object value) {
        for (Map<String, Object> option : options) {
            if (sameValue(option.get("value"), value)) {
                return Nodes.stringify(option.get("label"));
            }
        }
        return Nodes.stringify(value);
    }

    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return a != null && b != null && Nodes.stringify(a).equals(Nodes.stringify(b));
    }

    private static Map<String, Object> option(Object value, Object label) {
        Map<String, Object> option = new LinkedHashMap<>();
        option.put("value", value);
        option.put("label", label);
        return option;
    }
}

package work.pupt.kernel.core.ask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import work.pupt.kernel.runtime.Props;

/**
 * Several choices. Unanswered multi-selects default to an empty list.
 */
public final class AskMultiSelect extends AskComponent {
    public AskMultiSelect() {
        super("Ask.MultiSelect", "multiselect");
    }

    @Override
    protected Object implicitDefault(Props props) {
        return List.of();
    }

    @Override
    protected Object coerce(Object answer, Props props) {
        if (answer instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (answer instanceof String text) {
            List<Object> values = new ArrayList<>();
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
            return values;
        }
        return List.of(answer);
    }

    @Override
    protected List<Map<String, Object>> options(Props props) {
        return collectOptions(props, AskOption.class);
    }

    @Override
    protected Double min(Props props) {
        return props.number("minSelections");
    }

    @Override
    protected Double max(Props props) {
        return props.number("maxSelections");
    }

    @Override
    protected String display(Object resolved, Props props) {
        List<Map<String, Object>> options = options(props);
        List<String> labels = new ArrayList<>();
        for (Object value : (Collection<?>) resolved) {
            labels.add(labelFor(options, value));
        }
        return String.join(", ", labels);
    }
}

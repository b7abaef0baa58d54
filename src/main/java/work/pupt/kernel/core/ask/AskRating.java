package work.pupt.kernel.core.ask;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import work.pupt.kernel.element.Nodes;
import work.pupt.kernel.runtime.Props;

/**
 * Numeric rating on a {@code min..max} scale. Resolves to a {@code {value, label}} map so that a
 * reference can pick either field.
 */
public final class AskRating extends AskComponent {
    public AskRating() {
        super("Ask.Rating", "rating");
    }

    @Override
    protected Object coerce(Object answer, Props props) {
        Object value = answer instanceof Map<?, ?> map ? map.get("value") : answer;
        if (value instanceof String text && !text.isBlank()) {
            value = Double.parseDouble(text.trim());
        }
        if (value instanceof Double number && number == Math.rint(number)) {
            value = number.intValue();
        }
        Map<String, Object> rating = new LinkedHashMap<>();
        rating.put("value", value);
        String label = labelFor(options(props), value);
        rating.put("label", label.equals(Nodes.stringify(value)) ? null : label);
        return rating;
    }

    @Override
    protected List<Map<String, Object>> options(Props props) {
        List<Map<String, Object>> labels = collectOptions(props, AskLabel.class);
        for (var entry : props.map("labels").entrySet()) {
            Map<String, Object> option = new LinkedHashMap<>();
            option.put("value", entry.getKey());
            option.put("label", entry.getValue());
            labels.add(option);
        }
        return labels;
    }

    @Override
    protected Double min(Props props) {
        Double min = props.number("min");
        return min == null ? 1.0 : min;
    }

    @Override
    protected Double max(Props props) {
        Double max = props.number("max");
        return max == null ? 5.0 : max;
    }

    @Override
    protected String display(Object resolved, Props props) {
        Map<?, ?> rating = (Map<?, ?>) resolved;
        String value = Nodes.stringify(rating.get("value"));
        Object label = rating.get("label");
        return label == null ? value : value + " (" + label + ")";
    }
}

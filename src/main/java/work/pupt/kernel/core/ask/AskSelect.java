package work.pupt.kernel.core.ask;

import java.util.List;
import java.util.Map;

import work.pupt.kernel.runtime.Props;

/**
 * Single choice among {@code options} and {@code Ask.Option} children. Renders the chosen label.
 */
public final class AskSelect extends AskComponent {
    public AskSelect() {
        super("Ask.Select", "select");
    }

    @Override
    protected List<Map<String, Object>> options(Props props) {
        return collectOptions(props, AskOption.class);
    }

    @Override
    protected String display(Object resolved, Props props) {
        return labelFor(options(props), resolved);
    }
}

package work.pupt.kernel.core.ask;

import work.pupt.kernel.runtime.Props;

public final class AskNumber extends AskComponent {
    public AskNumber() {
        super("Ask.Number", "number");
    }

    @Override
    protected Object coerce(Object answer, Props props) {
        if (answer instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Answer for " + props.string("name") + " is not a number: " + text, ex);
            }
        }
        return answer;
    }
}

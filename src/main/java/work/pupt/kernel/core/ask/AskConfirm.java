package work.pupt.kernel.core.ask;

import java.util.Locale;

import work.pupt.kernel.runtime.Props;

/**
 * Yes/no question. Unanswered confirms default to {@code false}.
 */
public final class AskConfirm extends AskComponent {
    public AskConfirm() {
        super("Ask.Confirm", "confirm");
    }

    @Override
    protected Object implicitDefault(Props props) {
        return Boolean.FALSE;
    }

    @Override
    protected Object coerce(Object answer, Props props) {
        if (answer instanceof Boolean) {
            return answer;
        }
        if (answer instanceof Number number) {
            return number.doubleValue() != 0;
        }
        String raw = String.valueOf(answer).trim().toLowerCase(Locale.ROOT);
        return raw.equals("true") || raw.equals("yes") || raw.equals("y") || raw.equals("1");
    }

    @Override
    protected String display(Object resolved, Props props) {
        return Boolean.TRUE.equals(resolved) ? "Yes" : "No";
    }
}

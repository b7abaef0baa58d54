package work.pupt.kernel.core.utility;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import work.pupt.kernel.runtime.EnvironmentFacts.RuntimeFacts;
import work.pupt.kernel.runtime.Props;

/**
 * Render timestamp. {@code format} is {@code date}, {@code time}, {@code iso} (default) or a
 * {@link DateTimeFormatter} pattern.
 */
public final class DateTime extends RuntimeFactComponent {
    public DateTime() {
        super("DateTime");
    }

    @Override
    Object fact(RuntimeFacts facts, Props props) {
        String format = props.string("format", "iso");
        return switch (format) {
            case "date" -> facts.date();
            case "time" -> facts.time();
            case "iso" -> facts.timestamp().toString();
            default -> DateTimeFormatter.ofPattern(format).withZone(ZoneId.systemDefault()).format(facts.timestamp());
        };
    }
}

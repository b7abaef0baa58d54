package work.pupt.kernel.api;

import java.util.Locale;

/**
 * Document-level delimiter style.
 */
public enum OutputFormat {
    XML("xml"),
    MARKDOWN("markdown"),
    TEXT("none");

    private final String delimiter;

    OutputFormat(String delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Delimiter style structural components use when none is set on them or their scope.
     */
    public String delimiter() {
        return delimiter;
    }

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return XML;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "xml" -> XML;
            case "markdown", "md" -> MARKDOWN;
            case "text", "plain", "none" -> TEXT;
            default -> throw new IllegalArgumentException("Unsupported output format: " + raw);
        };
    }
}

package work.pupt.kernel.runtime;

/**
 * Render output node whose rendered text gets {@code indent} prepended to every non-empty line.
 */
public record Indented(String indent, Object children) {}

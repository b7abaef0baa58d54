package work.pupt.kernel.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import work.pupt.kernel.runtime.AnswerSource;
import work.pupt.kernel.runtime.EnvironmentFacts;

/**
 * Immutable options for one {@link PromptRenderer#render} call.
 */
public record RenderOptions(
    OutputFormat format,
    boolean trim,
    String indent,
    int maxDepth,
    Map<String, Object> answers,
    EnvironmentFacts environment,
    boolean strictValidation,
    boolean throwOnWarnings,
    Set<String> ignoreWarnings,
    AnswerSource answerSource
) {
    public static final int DEFAULT_MAX_DEPTH = 128;

    public RenderOptions {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(answerSource, "answerSource");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        answers = answers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
        ignoreWarnings = ignoreWarnings == null ? Set.of() : Set.copyOf(ignoreWarnings);
    }

    public static RenderOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OutputFormat format = OutputFormat.XML;
        private boolean trim = true;
        private String indent = "";
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Map<String, Object> answers = Map.of();
        private EnvironmentFacts environment = EnvironmentFacts.defaults();
        private boolean strictValidation;
        private boolean throwOnWarnings;
        private Set<String> ignoreWarnings = Set.of();
        private AnswerSource answerSource = AnswerSource.NONE;

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder trim(boolean trim) {
            this.trim = trim;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder answers(Map<String, Object> answers) {
            this.answers = answers;
            return this;
        }

        public Builder environment(EnvironmentFacts environment) {
            this.environment = environment;
            return this;
        }

        public Builder strictValidation(boolean strictValidation) {
            this.strictValidation = strictValidation;
            return this;
        }

        public Builder throwOnWarnings(boolean throwOnWarnings) {
            this.throwOnWarnings = throwOnWarnings;
            return this;
        }

        public Builder ignoreWarnings(Set<String> ignoreWarnings) {
            this.ignoreWarnings = ignoreWarnings;
            return this;
        }

        public Builder answerSource(AnswerSource answerSource) {
            this.answerSource = answerSource;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(
                format,
                trim,
                indent,
                maxDepth,
                answers,
                environment,
                strictValidation,
                throwOnWarnings,
                ignoreWarnings,
                answerSource
            );
        }
    }
}

package work.pupt.kernel.runtime;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

import work.pupt.kernel.api.OutputFormat;

/**
 * Facts about the render target and the host, visible to every component.
 */
public record EnvironmentFacts(Llm llm, Output output, Code code, PromptDefaults prompt, RuntimeFacts runtime) {
    public EnvironmentFacts {
        llm = llm == null ? Llm.defaults() : llm;
        output = output == null ? Output.defaults() : output;
        code = code == null ? Code.defaults() : code;
        prompt = prompt == null ? PromptDefaults.defaults() : prompt;
    }

    public static EnvironmentFacts defaults() {
        return new EnvironmentFacts(Llm.defaults(), Output.defaults(), Code.defaults(), PromptDefaults.defaults(), null);
    }

    public EnvironmentFacts withLlm(Llm value) {
        return new EnvironmentFacts(value, output, code, prompt, runtime);
    }

    public EnvironmentFacts withOutput(Output value) {
        return new EnvironmentFacts(llm, value, code, prompt, runtime);
    }

    public EnvironmentFacts withCode(Code value) {
        return new EnvironmentFacts(llm, output, value, prompt, runtime);
    }

    public EnvironmentFacts withPrompt(PromptDefaults value) {
        return new EnvironmentFacts(llm, output, code, value, runtime);
    }

    public EnvironmentFacts withRuntime(RuntimeFacts value) {
        return new EnvironmentFacts(llm, output, code, prompt, value);
    }

    public record Llm(String model, String provider, Integer maxTokens, Double temperature) {
        public static Llm defaults() {
            return new Llm("claude-3-sonnet", "anthropic", null, null);
        }

        public Llm withProvider(String value) {
            return new Llm(model, value, maxTokens, temperature);
        }

        public Llm withModel(String value) {
            return new Llm(value, provider, maxTokens, temperature);
        }
    }

    public record Output(OutputFormat format, boolean trim, String indent) {
        public Output {
            format = format == null ? OutputFormat.XML : format;
            indent = indent == null ? "" : indent;
        }

        public static Output defaults() {
            return new Output(OutputFormat.XML, true, "");
        }
    }

    public record Code(String language) {
        public static Code defaults() {
            return new Code("typescript");
        }
    }

    /**
     * Sections a {@code Prompt} adds on its own when its children do not provide them. A prompt's
     * {@code defaults} prop overrides these per section.
     */
    public record PromptDefaults(
        boolean includeRole,
        boolean includeFormat,
        boolean includeConstraints,
        String defaultRole
    ) {
        public PromptDefaults {
            defaultRole = defaultRole == null || defaultRole.isBlank() ? "assistant" : defaultRole;
        }

        public static PromptDefaults defaults() {
            return new PromptDefaults(false, false, false, "assistant");
        }

        public static PromptDefaults all() {
            return new PromptDefaults(true, true, true, "assistant");
        }
    }

    public record RuntimeFacts(
        String hostname,
        String username,
        String cwd,
        Instant timestamp,
        String date,
        String time,
        String uuid
    ) {
        /**
         * Captures host facts from the JVM without touching the network.
         */
        public static RuntimeFacts capture() {
            ZonedDateTime now = ZonedDateTime.now(ZoneId.systemDefault()).truncatedTo(ChronoUnit.SECONDS);
            return new RuntimeFacts(
                hostFromEnv(),
                System.getProperty("user.name", "unknown"),
                System.getProperty("user.dir", "."),
                now.toInstant(),
                LocalDate.from(now).format(DateTimeFormatter.ISO_LOCAL_DATE),
                LocalTime.from(now).format(DateTimeFormatter.ISO_LOCAL_TIME),
                UUID.randomUUID().toString()
            );
        }

        private static String hostFromEnv() {
            String value = System.getenv("HOSTNAME");
            if (value == null || value.isBlank()) {
                value = System.getenv("COMPUTERNAME");
            }
            return Objects.requireNonNullElse(value, "localhost");
        }
    }
}

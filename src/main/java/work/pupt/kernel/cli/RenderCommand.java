package work.pupt.kernel.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import work.pupt.kernel.api.OutputFormat;
import work.pupt.kernel.api.PromptRenderer;
import work.pupt.kernel.api.RenderOptions;
import work.pupt.kernel.api.RenderResult;
import work.pupt.kernel.core.BuiltinComponents;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.runtime.DocumentLoadException;
import work.pupt.kernel.runtime.DocumentLoader;
import work.pupt.kernel.runtime.EnvironmentFacts;
import work.pupt.kernel.runtime.RenderError;

@CommandLine.Command(
    name = "pupt-render",
    description = "Render a serialized prompt element tree.",
    mixinStandardHelpOptions = true,
    versionProvider = RenderCommand.Version.class,
    showDefaultValues = true
)
final class RenderCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--document"},
        required = true,
        description = "Element tree document (YAML or JSON)."
    )
    private Path document;

    @CommandLine.Option(
        names = {"-i", "--inputs"},
        paramLabel = "PATH|-|JSON",
        description = "Pre-seeded answers: JSON file, '-' for stdin, or an inline JSON object.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String inputs;

    @CommandLine.Option(
        names = "--format",
        description = "Delimiter style (xml|markdown|text).",
        defaultValue = "xml"
    )
    private String format;

    @CommandLine.Option(
        names = "--no-trim",
        description = "Keep leading and trailing whitespace."
    )
    private boolean noTrim;

    @CommandLine.Option(
        names = "--indent",
        description = "Indentation applied inside XML-delimited blocks."
    )
    private String indent = "";

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum element nesting before rendering fails closed.",
        defaultValue = "" + RenderOptions.DEFAULT_MAX_DEPTH
    )
    private int maxDepth;

    @CommandLine.Option(
        names = "--provider",
        description = "LLM provider visible to conditionals.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String provider;

    @CommandLine.Option(
        names = "--model",
        description = "LLM model visible to components.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String model;

    @CommandLine.Option(
        names = "--prompt-defaults",
        description = "Let Prompt add default role, format and constraints sections."
    )
    private boolean promptDefaults;

    @CommandLine.Option(
        names = "--strict",
        description = "Report components without a schema."
    )
    private boolean strict;

    @CommandLine.Option(
        names = "--json",
        description = "Print the full result as JSON."
    )
    private boolean json;

    @Override
    public Integer call() throws Exception {
        Map<String, Object> answers = loadAnswers();
        OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.from(format);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }

        EnvironmentFacts.Llm llm = EnvironmentFacts.Llm.defaults();
        if (provider != null && !provider.isBlank()) {
            llm = llm.withProvider(provider);
        }
        if (model != null && !model.isBlank()) {
            llm = llm.withModel(model);
        }

        var renderer = new PromptRenderer();
        Element root;
        try {
            root = new DocumentLoader(renderer.registry()).load(document);
        } catch (DocumentLoadException ex) {
            log.warn("Unable to load {}: {}", document, ex.getMessage());
            throw ex;
        }

        RenderOptions options = RenderOptions.builder()
            .format(outputFormat)
            .trim(!noTrim)
            .indent(indent)
            .maxDepth(maxDepth)
            .answers(answers)
            .environment(EnvironmentFacts.defaults()
                .withLlm(llm)
                .withPrompt(promptDefaults ? EnvironmentFacts.PromptDefaults.all() : EnvironmentFacts.PromptDefaults.defaults()))
            .strictValidation(strict)
            .build();

        RenderResult result = renderer.render(root, options);
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else {
            out.println(result.text());
            PrintWriter err = spec.commandLine().getErr();
            for (RenderError warning : result.warnings()) {
                err.println("warning: " + warning);
            }
            for (RenderError error : result.errors()) {
                err.println("error: " + error);
            }
            err.flush();
        }
        out.flush();
        return result.status().exitCode();
    }

    private Map<String, Object> loadAnswers() {
        String payload = loadInputPayload();
        try {
            Map<String, Object> parsed = JSON.readValue(payload, MAP_TYPE);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON inputs: " + ex.getMessage());
        }
    }

    private String loadInputPayload() {
        if (inputs == null || inputs.isBlank()) {
            return "{}";
        }
        if ("-".equals(inputs)) {
            return readStdin();
        }
        String trimmed = inputs.trim();
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        Path path = Paths.get(inputs).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read inputs file: " + path);
        }
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            byte[] bytes = stdin.readAllBytes();
            if (bytes.length == 0) {
                return "{}";
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }

    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = Objects.requireNonNullElse(
                RenderCommand.class.getPackage().getImplementationVersion(), "development");
            return new String[] {
                "pupt-render (java) " + version,
                "built-in components: " + BuiltinComponents.create().entries().size()
            };
        }
    }
}

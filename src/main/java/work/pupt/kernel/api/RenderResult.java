package work.pupt.kernel.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import work.pupt.kernel.runtime.InputRequirement;
import work.pupt.kernel.runtime.PostExecutionAction;
import work.pupt.kernel.runtime.RenderError;

/**
 * Outcome of a render. {@code text} is always populated, best-effort when the status is failure.
 */
public record RenderResult(
    Status status,
    String text,
    List<RenderError> errors,
    List<RenderError> warnings,
    List<PostExecutionAction> postExecution,
    List<InputRequirement> inputRequirements,
    Map<String, Object> answers
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RenderResult {
        text = text == null ? "" : text;
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        postExecution = List.copyOf(postExecution);
        inputRequirements = List.copyOf(inputRequirements);
        answers = Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }

    public static RenderResult success(
        String text,
        List<RenderError> warnings,
        List<PostExecutionAction> postExecution,
        List<InputRequirement> inputRequirements,
        Map<String, Object> answers
    ) {
        return new RenderResult(Status.SUCCESS, text, List.of(), warnings, postExecution, inputRequirements, answers);
    }

    public static RenderResult failure(
        String text,
        List<RenderError> errors,
        List<RenderError> warnings,
        List<PostExecutionAction> postExecution,
        List<InputRequirement> inputRequirements,
        Map<String, Object> answers
    ) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed render must carry at least one error");
        }
        return new RenderResult(Status.FAILURE, text, errors, warnings, postExecution, inputRequirements, answers);
    }

    public boolean ok() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("ok", ok());
        serializable.put("text", text);
        if (!ok()) {
            serializable.put("errors", toMaps(errors));
        }
        if (!warnings.isEmpty()) {
            serializable.put("warnings", toMaps(warnings));
        }
        List<Map<String, Object>> actions = new ArrayList<>();
        postExecution.forEach(action -> actions.add(action.toMap()));
        serializable.put("postExecution", actions);
        List<Map<String, Object>> requirements = new ArrayList<>();
        inputRequirements.forEach(requirement -> requirements.add(requirement.toMap()));
        serializable.put("inputRequirements", requirements);
        serializable.put("answers", answers);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"ok\":false,\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    private static List<Map<String, Object>> toMaps(List<RenderError> list) {
        List<Map<String, Object>> out = new ArrayList<>();
        list.forEach(error -> out.add(error.toMap()));
        return out;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}

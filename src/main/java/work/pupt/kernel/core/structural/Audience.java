package work.pupt.kernel.core.structural;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class Audience extends BuiltinComponent {
    public Audience() {
        super("Audience");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String style = Delimiters.style(props, context);
        if (!props.children().isEmpty()) {
            return Delimiters.wrap("audience", props.children(), style, context);
        }
        String level = props.string("level");
        String type = props.string("type");
        List<String> lines = new ArrayList<>();
        if (level != null || type != null) {
            List<String> words = new ArrayList<>();
            if (level != null) {
                words.add(level);
            }
            if (type != null) {
                words.add(type);
            }
            lines.add("Target audience: " + String.join(" ", words) + " users");
        }
        if (props.has("description")) {
            lines.add(props.string("description"));
        }
        if (props.has("knowledgeLevel")) {
            lines.add("Assume they know: " + props.string("knowledgeLevel"));
        }
        List<String> goals = props.strings("goals");
        if (!goals.isEmpty()) {
            lines.add("Their goals: " + String.join(", ", goals));
        }
        String guidance = level == null ? null : guidance(level);
        if (guidance != null) {
            lines.add("");
            lines.add(guidance);
        }
        return Delimiters.wrap("audience", String.join("\n", lines), style, context);
    }

    private static String guidance(String level) {
        return switch (level) {
            case "beginner" -> "Use simple language, avoid jargon, and provide analogies where helpful.";
            case "intermediate" -> "You can use technical terms but provide brief explanations when needed.";
            case "advanced" -> "Use full technical vocabulary and assume strong foundational knowledge.";
            case "expert" -> "Communicate as a peer; no need to explain standard concepts.";
            case "mixed" -> "Provide multiple levels of explanation when covering technical topics.";
            default -> null;
        };
    }
}

package work.pupt.kernel.core.structural;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Voice instructions built from {@code type}, the voice characteristics, a brand voice and tones
 * to avoid.
 */
public final class Tone extends BuiltinComponent {
    public Tone() {
        super("Tone");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String style = Delimiters.style(props, context);
        if (!props.children().isEmpty()) {
            return Delimiters.wrap("tone", props.children(), style, context);
        }
        List<String> lines = new ArrayList<>();
        if (props.has("type")) {
            String type = props.string("type");
            lines.add("Tone: " + type);
            String description = description(type);
            if (description != null) {
                lines.add(description);
            }
        }
        List<String> voice = new ArrayList<>();
        for (String trait : List.of("formality", "energy", "warmth")) {
            if (props.has(trait)) {
                voice.add(trait + ": " + props.string(trait));
            }
        }
        if (!voice.isEmpty()) {
            lines.add("Voice characteristics: " + String.join(", ", voice));
        }
        if (props.has("brandVoice")) {
            lines.add("Match the " + props.string("brandVoice") + " brand voice.");
        }
        List<String> avoid = props.strings("avoidTones");
        if (!avoid.isEmpty()) {
            lines.add("Avoid these tones: " + String.join(", ", avoid));
        }
        return Delimiters.wrap("tone", String.join("\n", lines), style, context);
    }

    private static String description(String type) {
        return switch (type) {
            case "professional" -> "Maintain a formal, business-appropriate communication style.";
            case "casual" -> "Use a relaxed, conversational style.";
            case "friendly" -> "Be warm, approachable, and supportive.";
            case "academic" -> "Use scholarly precision with formal structure.";
            case "authoritative" -> "Be confident and decisive in your guidance.";
            case "empathetic" -> "Show understanding and emotional sensitivity.";
            case "enthusiastic" -> "Be energetic and positive.";
            case "neutral" -> "Maintain objectivity and balanced perspective.";
            case "humorous" -> "Use light humor and wit where appropriate.";
            case "serious" -> "Address topics with gravity and importance.";
            default -> null;
        };
    }
}

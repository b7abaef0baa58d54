package work.pupt.kernel.core.structural;

import java.util.ArrayList;
import java.util.List;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Reasoning instruction in one of the {@code style}s. Children replace the generated text.
 */
public final class ChainOfThought extends BuiltinComponent {
    static final String SHOW_REASONING = "Show your reasoning before giving the final answer.";

    public ChainOfThought() {
        super("ChainOfThought");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String style = Delimiters.style(props, context);
        if (!props.children().isEmpty()) {
            return Delimiters.wrap("reasoning", props.children(), style, context);
        }
        List<String> lines = new ArrayList<>();
        lines.add(switch (props.string("style", "step-by-step")) {
            case "think-aloud" -> "Think aloud and share your thought process as you work through the problem.";
            case "structured" -> "Structure your reasoning as:\n"
                + "1. Understanding: restate the problem\n"
                + "2. Analysis: work through the details\n"
                + "3. Conclusion: state the answer";
            case "minimal" -> "Think carefully before answering.";
            default -> "Think through this step by step.";
        });
        if (props.bool("showReasoning", true)) {
            lines.add(SHOW_REASONING);
        }
        return Delimiters.wrap("reasoning", String.join("\n", lines), style, context);
    }
}

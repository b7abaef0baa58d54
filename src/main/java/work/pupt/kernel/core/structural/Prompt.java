package work.pupt.kernel.core.structural;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.core.Children;
import work.pupt.kernel.core.Delimiters;
import work.pupt.kernel.core.PromptPresets;
import work.pupt.kernel.element.Element;
import work.pupt.kernel.runtime.EnvironmentFacts.PromptDefaults;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;
import work.pupt.kernel.runtime.RenderError;
import work.pupt.kernel.runtime.Scoped;

/**
 * Document root. Opens a scope named after the prompt that carries its delimiter default.
 *
 * <p>Unless {@code bare} is set (or {@code defaults = "none"}), the prompt adds a role section
 * before its children and format and constraints sections after them when the children do not
 * provide their own. Which sections are added comes from {@code env.prompt}, overridden per prompt
 * by the {@code defaults} map and the {@code noRole}, {@code noFormat} and {@code noConstraints}
 * shorthands. A {@code role} prop always asks for a role section.
 */
public final class Prompt extends BuiltinComponent {
    public static final String WARN_MISSING_TASK = "warn_missing_task";
    public static final String WARN_CONFLICTING_INSTRUCTIONS = "warn_conflicting_instructions";
    static final String NO_DEFAULTS = "none";

    private final PromptPresets presets;

    public Prompt() {
        this(PromptPresets.bundled());
    }

    Prompt(PromptPresets presets) {
        super("Prompt");
        this.presets = presets;
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        String promptName = props.string("name");
        Map<String, Object> scopeValues = new LinkedHashMap<>();
        if (props.has(Delimiters.SCOPE_KEY)) {
            scopeValues.put(Delimiters.SCOPE_KEY, props.string(Delimiters.SCOPE_KEY));
        }
        List<Object> children = props.children();
        if (props.bool("bare", false) || NO_DEFAULTS.equals(props.get("defaults"))) {
            return Scoped.within(promptName, scopeValues, children);
        }

        if (!Children.contains(children, Task.class)) {
            context.addError(RenderError.warning(name(), WARN_MISSING_TASK,
                "Prompt \"" + promptName + "\" has no Task"));
        }
        if (strictFormatWithReasoning(children)) {
            context.addError(RenderError.warning(name(), WARN_CONFLICTING_INSTRUCTIONS,
                "Format strict asks for only the formatted output while ChainOfThought asks to show "
                    + "reasoning; set showReasoning to false or drop strict"));
        }

        Map<String, Object> overrides = overrides(props);
        PromptDefaults config = context.env().prompt();
        String style = Delimiters.style(props, context);
        PromptPresets.ProviderAdaptation adaptation = presets.provider(context.env().llm().provider());

        List<Object> parts = new ArrayList<>();
        boolean includeRole = include(overrides, "role", config.includeRole() || props.has("role"));
        if (includeRole && !Children.contains(children, Role.class)) {
            parts.add(Delimiters.wrap("role", roleText(props, config, adaptation), style, context));
        }

        parts.add(children);

        boolean includeFormat = include(overrides, "format", config.includeFormat());
        if (includeFormat && !Children.contains(children, Format.class)) {
            parts.add(Delimiters.wrap("format", "Output format: " + adaptation.formatPreference(), style, context));
        }

        boolean includeConstraints = include(overrides, "constraints", config.includeConstraints());
        List<Element> containers = Children.ofType(children, Constraints.class);
        if (!containers.isEmpty()) {
            Map<String, Object> container = containers.get(0).props();
            if (includeConstraints && Boolean.TRUE.equals(container.get("extend"))) {
                parts.add(Delimiters.wrap("constraints", constraintLines(excludes(container.get("exclude"))), style, context));
            }
        } else if (includeConstraints && !Children.contains(children, Constraint.class)) {
            parts.add(Delimiters.wrap("constraints", constraintLines(List.of()), style, context));
        }
        return Scoped.within(promptName, scopeValues, parts);
    }

    private static Map<String, Object> overrides(Props props) {
        Map<String, Object> overrides = new LinkedHashMap<>(props.map("defaults"));
        if (props.bool("noRole", false)) {
            overrides.put("role", false);
        }
        if (props.bool("noFormat", false)) {
            overrides.put("format", false);
        }
        if (props.bool("noConstraints", false)) {
            overrides.put("constraints", false);
        }
        return overrides;
    }

    private static boolean include(Map<String, Object> overrides, String section, boolean fallback) {
        Object value = overrides.get(section);
        return value instanceof Boolean flag ? flag : fallback;
    }

    private String roleText(Props props, PromptDefaults config, PromptPresets.ProviderAdaptation adaptation) {
        String role = props.string("role");
        String expertise = props.string("expertise");
        PromptPresets.RolePreset preset = presets.role(role == null ? config.defaultRole() : role);
        StringBuilder text = new StringBuilder();
        if (preset != null) {
            text.append(adaptation.rolePrefix()).append("a helpful ").append(preset.title()).append('.');
            if (expertise == null && !preset.expertise().isEmpty()) {
                expertise = String.join(", ", preset.expertise());
            }
        } else {
            text.append(role == null ? adaptation.rolePrefix() + "a helpful " + config.defaultRole() + "." : role);
        }
        if (expertise != null) {
            text.append(" You have expertise in ").append(expertise).append('.');
        }
        return text.toString();
    }

    private String constraintLines(List<String> exclude) {
        List<String> lines = new ArrayList<>();
        for (String constraint : presets.constraints()) {
            String lower = constraint.toLowerCase(Locale.ROOT);
            if (exclude.stream().noneMatch(ex -> lower.contains(ex.toLowerCase(Locale.ROOT)))) {
                lines.add("- " + constraint);
            }
        }
        return String.join("\n", lines);
    }

    private static List<String> excludes(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
        } else if (raw != null) {
            out.add(raw.toString());
        }
        return out;
    }

    private static boolean strictFormatWithReasoning(List<Object> children) {
        boolean strict = Children.ofType(children, Format.class).stream()
            .anyMatch(format -> Boolean.TRUE.equals(format.props().get("strict")));
        return strict && Children.ofType(children, ChainOfThought.class).stream()
            .anyMatch(cot -> !Boolean.FALSE.equals(cot.props().get("showReasoning")));
    }
}

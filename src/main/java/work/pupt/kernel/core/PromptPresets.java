package work.pupt.kernel.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Role presets, provider adaptations and default constraints, read once from {@value #RESOURCE}.
 */
public final class PromptPresets {
    public static final String RESOURCE = "/pupt/presets.toml";
    static final String UNSPECIFIED = "unspecified";

    public record RolePreset(String title, List<String> expertise) {
        public RolePreset {
            expertise = List.copyOf(expertise);
        }
    }

    public record ProviderAdaptation(String rolePrefix, String formatPreference) {}

    private final Map<String, RolePreset> roles;
    private final Map<String, ProviderAdaptation> providers;
    private final List<String> constraints;

    private PromptPresets(
        Map<String, RolePreset> roles,
        Map<String, ProviderAdaptation> providers,
        List<String> constraints
    ) {
        this.roles = Map.copyOf(roles);
        this.providers = Map.copyOf(providers);
        this.constraints = List.copyOf(constraints);
    }

    public static PromptPresets bundled() {
        return Holder.BUNDLED;
    }

    public RolePreset role(String key) {
        return key == null ? null : roles.get(key.toLowerCase(Locale.ROOT));
    }

    /**
     * Adaptation for {@code provider}, falling back to the {@code unspecified} entry.
     */
    public ProviderAdaptation provider(String provider) {
        ProviderAdaptation found = provider == null ? null : providers.get(provider.toLowerCase(Locale.ROOT));
        if (found == null) {
            found = providers.get(UNSPECIFIED);
        }
        return found == null ? new ProviderAdaptation("You are ", Delimiters.MARKDOWN) : found;
    }

    public List<String> constraints() {
        return constraints;
    }

    public static PromptPresets parse(String source, String origin) {
        TomlParseResult result = Toml.parse(source);
        if (result.hasErrors()) {
            String details = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid preset file " + origin + ": " + details);
        }

        Map<String, RolePreset> roles = new LinkedHashMap<>();
        TomlTable roleTable = result.getTable("roles");
        if (roleTable != null) {
            for (String key : roleTable.keySet()) {
                TomlTable role = roleTable.getTable(List.of(key));
                if (role != null) {
                    roles.put(key.toLowerCase(Locale.ROOT),
                        new RolePreset(role.getString("title", () -> key), strings(role.getArray("expertise"))));
                }
            }
        }

        Map<String, ProviderAdaptation> providers = new LinkedHashMap<>();
        TomlTable providerTable = result.getTable("providers");
        if (providerTable != null) {
            for (String key : providerTable.keySet()) {
                TomlTable provider = providerTable.getTable(List.of(key));
                if (provider != null) {
                    providers.put(key.toLowerCase(Locale.ROOT), new ProviderAdaptation(
                        provider.getString("role_prefix", () -> "You are "),
                        provider.getString("format_preference", () -> Delimiters.MARKDOWN)));
                }
            }
        }

        return new PromptPresets(roles, providers, strings(result.getArray(List.of("defaults", "constraints"))));
    }

    private static List<String> strings(TomlArray array) {
        List<String> out = new ArrayList<>();
        if (array != null) {
            for (Object item : array.toList()) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }

    private static final class Holder {
        static final PromptPresets BUNDLED = load();

        private static PromptPresets load() {
            try (InputStream in = PromptPresets.class.getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Preset file not found on classpath: " + RESOURCE);
                }
                return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), RESOURCE);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to read preset file " + RESOURCE, ex);
            }
        }
    }
}

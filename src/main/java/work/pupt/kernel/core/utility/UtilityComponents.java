package work.pupt.kernel.core.utility;

import work.pupt.kernel.runtime.ComponentRegistry;

public final class UtilityComponents {
    private UtilityComponents() {}

    public static ComponentRegistry register(ComponentRegistry registry) {
        registry.register(new Hostname());
        registry.register(new Username());
        registry.register(new Cwd());
        registry.register(new DateTime());
        registry.register(new Uuid());
        return registry;
    }
}

package work.pupt.kernel.core.data;

import work.pupt.kernel.runtime.ComponentRegistry;

public final class DataComponents {
    private DataComponents() {}

    public static ComponentRegistry register(ComponentRegistry registry) {
        registry.register(new File());
        registry.register(new Json());
        registry.register(new Code());
        return registry;
    }
}

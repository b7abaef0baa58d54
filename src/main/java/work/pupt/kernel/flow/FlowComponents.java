package work.pupt.kernel.flow;

import work.pupt.kernel.runtime.ComponentRegistry;

public final class FlowComponents {
    private FlowComponents() {}

    public static ComponentRegistry register(ComponentRegistry registry) {
        registry.register(new If());
        return registry;
    }
}

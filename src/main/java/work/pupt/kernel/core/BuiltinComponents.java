package work.pupt.kernel.core;

import work.pupt.kernel.core.ask.AskComponents;
import work.pupt.kernel.core.data.DataComponents;
import work.pupt.kernel.core.post.PostExecutionComponents;
import work.pupt.kernel.core.structural.StructuralComponents;
import work.pupt.kernel.core.utility.UtilityComponents;
import work.pupt.kernel.flow.FlowComponents;
import work.pupt.kernel.runtime.ComponentRegistry;

/**
 * Shared catalog bootstrap so the renderer, the document loader, the CLI and tests use the same
 * component set.
 */
public final class BuiltinComponents {
    private BuiltinComponents() {}

    public static ComponentRegistry create() {
        var registry = new ComponentRegistry();
        StructuralComponents.register(registry);
        AskComponents.register(registry);
        FlowComponents.register(registry);
        DataComponents.register(registry);
        PostExecutionComponents.register(registry);
        UtilityComponents.register(registry);
        return registry;
    }
}

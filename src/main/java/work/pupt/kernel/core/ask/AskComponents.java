package work.pupt.kernel.core.ask;

import work.pupt.kernel.runtime.ComponentRegistry;

public final class AskComponents {
    private AskComponents() {}

    public static ComponentRegistry register(ComponentRegistry registry) {
        registry.register(new AskText());
        registry.register(new AskNumber());
        registry.register(new AskConfirm());
        registry.register(new AskSelect());
        registry.register(new AskMultiSelect());
        registry.register(new AskRating());
        registry.register(new AskOption());
        registry.register(new AskLabel());
        return registry;
    }
}

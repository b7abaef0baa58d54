package work.pupt.kernel.core.structural;

import work.pupt.kernel.runtime.ComponentRegistry;

public final class StructuralComponents {
    private StructuralComponents() {}

    public static ComponentRegistry register(ComponentRegistry registry) {
        registry.register(new Prompt());
        registry.register(new Section());
        registry.register(new Role());
        registry.register(new Task());
        registry.register(new Context());
        registry.register(new Constraint());
        registry.register(new Constraints());
        registry.register(new Format());
        registry.register(new Steps());
        registry.register(new Step());
        registry.register(new ChainOfThought());
        registry.register(new Audience());
        registry.register(new Tone());
        return registry;
    }
}

package work.pupt.kernel.core.post;

import work.pupt.kernel.runtime.ComponentRegistry;

public final class PostExecutionComponents {
    private PostExecutionComponents() {}

    public static ComponentRegistry register(ComponentRegistry registry) {
        registry.register(new PostExecution());
        registry.register(new ReviewFile());
        registry.register(new OpenUrl());
        registry.register(new RunCommand());
        return registry;
    }
}

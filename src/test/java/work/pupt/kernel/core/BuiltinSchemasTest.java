package work.pupt.kernel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.core.structural.Task;
import work.pupt.kernel.element.Elements;
import work.pupt.kernel.schema.PropType;

class BuiltinSchemasTest {
    @Test
    void everyBuiltinHasASchema() {
        var registry = BuiltinComponents.create();

        registry.entries().forEach((name, component) ->
            assertNotNull(component.schema(), () -> "no schema for " + name));
        assertEquals(registry.entries().keySet(), BuiltinSchemas.names());
    }

    @Test
    void askInputsRequireAName() {
        var spec = BuiltinSchemas.forComponent("Ask.Select").prop("name");

        assertTrue(spec.required());
        assertTrue(spec.types().contains(PropType.STRING));
    }

    @Test
    void childrenHelpersLookThroughFragments() {
        var registry = BuiltinComponents.create();
        var task = Elements.element(registry.get("Task"));
        var children = List.<Object>of("text", Elements.fragment(task));

        assertTrue(Children.contains(children, Task.class));
        assertEquals(1, Children.ofType(children, Task.class).size());
    }
}

package work.pupt.kernel.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.pupt.kernel.api.PromptRenderer;
import work.pupt.kernel.core.structural.Section;
import work.pupt.kernel.core.structural.Task;
import work.pupt.kernel.runtime.ComponentRegistry;
import work.pupt.kernel.runtime.RenderError;

class IdentityTest {
    private URLClassLoader isolated;

    @BeforeEach
    void openIsolatedCopy() {
        URL classes = Element.class.getProtectionDomain().getCodeSource().getLocation();
        isolated = new URLClassLoader(new URL[] {classes}, ClassLoader.getPlatformClassLoader());
    }

    @AfterEach
    void closeIsolatedCopy() throws Exception {
        isolated.close();
    }

    private Object foreignComponent(String className) throws Exception {
        return isolated.loadClass(className).getConstructor().newInstance();
    }

    private Object foreignElement(Object component, Map<String, Object> props, Object... children) throws Exception {
        Class<?> elements = isolated.loadClass(Elements.class.getName());
        Class<?> componentType = isolated.loadClass("work.pupt.kernel.runtime.Component");
        Method element = elements.getMethod("element", componentType, Map.class, Object[].class);
        return element.invoke(null, component, props, children);
    }

    @Test
    void symbolsAreProcessWide() throws Exception {
        assertSame(GlobalSymbols.FRAGMENT, GlobalSymbols.symbolFor("pupt-kernel:fragment"));
        assertNotSame("pupt-kernel:fragment", GlobalSymbols.FRAGMENT);

        Class<?> foreignSymbols = isolated.loadClass(GlobalSymbols.class.getName());
        assertNotSame(GlobalSymbols.class, foreignSymbols);
        assertSame(GlobalSymbols.FRAGMENT, foreignSymbols.getField("FRAGMENT").get(null));
        assertSame(GlobalSymbols.TYPE, foreignSymbols.getField("TYPE").get(null));
    }

    @Test
    void localValuesAreRecognized() {
        var task = new Task();

        assertTrue(Identity.isElement(Elements.element(task)));
        assertFalse(Identity.isElement("text"));
        assertFalse(Identity.isElement(Function.identity()));
        assertTrue(Identity.isComponent(task));
        assertTrue(Identity.isComponentClass(Task.class));
        assertFalse(Identity.isComponentClass(String.class));
        assertEquals("Task", Identity.componentName(task));
    }

    @Test
    void foreignValuesAreRecognizedByMarker() throws Exception {
        Object section = foreignComponent(Section.class.getName());
        Object foreign = foreignElement(section, Map.of("name", "intro"), "body");

        assertFalse(foreign instanceof Element);
        assertTrue(Identity.isElement(foreign));
        assertTrue(Identity.isComponent(section));
        assertTrue(Identity.isComponentClass(section.getClass()));
        assertEquals("Section", Identity.componentName(section));

        Element adopted = Identity.adopt(foreign);
        assertSame(section, adopted.type());
        assertEquals("Section", adopted.typeName());
        assertEquals(Map.of("name", "intro"), adopted.props());
    }

    @Test
    void sharedForeignElementIsAdoptedOnce() throws Exception {
        Object task = foreignComponent(Task.class.getName());
        Object inner = foreignElement(task, Map.of(), "x");
        Object outer = foreignElement(task, Map.of("copy", inner), inner);

        Element adopted = Identity.adopt(outer, new IdentityHashMap<>());

        assertSame(adopted.children().get(0), adopted.props().get("copy"));
    }

    @Test
    void foreignTreesRenderWithLocalComponents() throws Exception {
        Object section = foreignComponent(Section.class.getName());
        Object foreign = foreignElement(section, Map.of("name", "intro"), "Hello from the plugin");

        var result = new PromptRenderer().render(Elements.fragment(foreign, "!"));

        assertTrue(result.ok(), () -> result.errors().toString());
        assertEquals("<intro>\nHello from the plugin\n</intro>\n!", result.text());
    }

    @Test
    void foreignComponentWithoutLocalRegistrationIsReported() throws Exception {
        Object section = foreignComponent(Section.class.getName());
        Object foreign = foreignElement(section, Map.of("name", "intro"), "Hello");

        var result = new PromptRenderer(new ComponentRegistry()).render(foreign);

        assertFalse(result.ok());
        assertEquals("Hello", result.text());
        RenderError error = result.errors().get(0);
        assertEquals(RenderError.UNKNOWN_COMPONENT, error.code());
        assertEquals("Component Section comes from another class loader and is not registered locally",
            error.message());
    }

    @Test
    void foreignInputsShareTheAnswersOfTheRender() throws Exception {
        var renderer = new PromptRenderer();
        Object ask = foreignComponent("work.pupt.kernel.core.ask.AskText");
        Object question = foreignElement(ask, Map.of("name", "lang", "default", "Java", "silent", true));
        var tree = Elements.fragment(
            question,
            Elements.element(renderer.registry().get("If"), Elements.props("formula", "=lang = 'JAVA'"), "match")
        );

        var result = renderer.render(tree);

        assertEquals("match", result.text());
        assertEquals("Java", result.answers().get("lang"));
    }
}

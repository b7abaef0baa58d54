package work.pupt.kernel.element;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import work.pupt.kernel.runtime.Component;

/**
 * Recognizes elements and components by their versioned marker keys rather than by class
 * identity, so values built by another loaded copy of the library are accepted.
 */
public final class Identity {
    private static final String ELEMENT_FIELD = "ELEMENT_MARKER";
    private static final String COMPONENT_FIELD = "COMPONENT_MARKER";

    private Identity() {}

    public static boolean isElement(Object value) {
        if (value instanceof Element) {
            return true;
        }
        return value instanceof Function<?, ?> && hasMarker(value.getClass(), ELEMENT_FIELD, GlobalSymbols.ELEMENT_KEY);
    }

    public static boolean isComponentClass(Object value) {
        if (!(value instanceof Class<?> type)) {
            return false;
        }
        if (Component.class.isAssignableFrom(type)) {
            return true;
        }
        return hasMarker(type, COMPONENT_FIELD, GlobalSymbols.COMPONENT_KEY);
    }

    public static boolean isComponent(Object value) {
        return value instanceof Component
            || (value != null && !(value instanceof Class<?>) && isComponentClass(value.getClass()));
    }

    /**
     * Returns the declared name of a component from any loaded copy, or {@code null}.
     */
    public static String componentName(Object value) {
        if (value instanceof Component component) {
            return component.name();
        }
        if (!isComponent(value)) {
            return null;
        }
        try {
            Method name = value.getClass().getMethod("name");
            Object result = name.invoke(value);
            return result == null ? null : result.toString();
        } catch (NoSuchMethodException | IllegalAccessException ex) {
            return null;
        } catch (InvocationTargetException ex) {
            throw new IllegalStateException("Component name lookup failed for " + value.getClass().getName(), ex.getCause());
        }
    }

    /**
     * Rebuilds an element created by another loaded copy as a local element. The foreign type is
     * kept as is; nested foreign elements are adopted recursively.
     */
    public static Element adopt(Object value) {
        return adopt(value, new IdentityHashMap<>());
    }

    /**
     * Same as {@link #adopt(Object)}, reusing and filling {@code adopted} so a shared foreign element
     * maps to one local element.
     */
    public static Element adopt(Object value, Map<Object, Element> adopted) {
        if (value instanceof Element element) {
            return element;
        }
        if (!isElement(value)) {
            throw new IllegalArgumentException("Not an element: " + value);
        }
        Element cached = adopted.get(value);
        if (cached != null) {
            return cached;
        }
        @SuppressWarnings("unchecked")
        Function<Object, Object> slots = (Function<Object, Object>) value;
        Object type = slots.apply(GlobalSymbols.TYPE);
        Map<String, Object> props = new LinkedHashMap<>();
        if (slots.apply(GlobalSymbols.PROPS) instanceof Map<?, ?> raw) {
            raw.forEach((key, item) -> props.put(String.valueOf(key), adoptValue(item, adopted)));
        }
        List<Object> children = new ArrayList<>();
        if (slots.apply(GlobalSymbols.CHILDREN) instanceof List<?> raw) {
            for (Object child : raw) {
                children.add(adoptValue(child, adopted));
            }
        }
        Element local = new Element(type, props, children);
        adopted.put(value, local);
        return local;
    }

    private static Object adoptValue(Object value, Map<Object, Element> adopted) {
        if (value instanceof Element || value == null) {
            return value;
        }
        if (isElement(value)) {
            return adopt(value, adopted);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(adoptValue(item, adopted));
            }
            return copy;
        }
        return value;
    }

    private static boolean hasMarker(Class<?> type, String fieldName, String expected) {
        try {
            Field field = type.getField(fieldName);
            if (!Modifier.isStatic(field.getModifiers())) {
                return false;
            }
            return expected.equals(field.get(null));
        } catch (NoSuchFieldException | IllegalAccessException ex) {
            return false;
        }
    }
}

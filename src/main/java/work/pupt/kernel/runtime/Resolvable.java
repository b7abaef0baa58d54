package work.pupt.kernel.runtime;

/**
 * Optional capability of a {@link Component}: computes a resolved value before rendering.
 *
 * <p>The value is kept for the rest of the render pass, keyed by element identity, and is visible to
 * other elements through deferred references.
 */
public interface Resolvable {
    Object resolve(Props props, RenderContext context) throws Exception;
}

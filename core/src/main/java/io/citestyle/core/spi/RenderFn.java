package io.citestyle.core.spi;

import io.citestyle.core.model.Rendered;

/**
 * A compiled fragment of a style: layout, sort key, macro body or any nested element. Produced by
 * the style compiler with every attribute fixed at compile time; the rendering context is supplied
 * fresh on each call.
 *
 * <p>
 * Implementations MUST be stateless so a single instance can serve concurrent renders.
 */
@FunctionalInterface
public interface RenderFn {

    /**
     * Renders this fragment for one entry.
     *
     * @param context per-call rendering state, owned by the caller
     * @return the rendered value, never {@code null}
     */
    Rendered render(RenderContext context);
}

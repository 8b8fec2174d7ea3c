package io.citestyle.core.spi;

/**
 * Per-render state threaded through compiled render functions: the entry being rendered,
 * suppression flags and the primitives that produce output. Supplied by the rendering runtime;
 * one instance per render call, never shared between concurrent renders.
 */
public interface RenderContext {

    /** The rendering primitives compiled functions dispatch to. */
    RenderPrimitives primitives();

    /** Returns {@code true} if author names must be suppressed in this render. */
    boolean suppressAuthor();
}

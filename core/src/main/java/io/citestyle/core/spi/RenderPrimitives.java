package io.citestyle.core.spi;

import io.citestyle.core.model.NamesSpec;
import io.citestyle.core.model.Rendered;
import java.util.List;
import java.util.Map;

/**
 * Rendering runtime SPI. There is one primitive per renderable CSL element; compiled functions
 * call them with the element's attributes, the current context and the element's compiled
 * children. Children are passed unevaluated so conditional primitives ({@code choose}) decide
 * which of them to run.
 *
 * <p>
 * Implementations MUST be thread-safe; all per-render state belongs in the {@link RenderContext}.
 */
public interface RenderPrimitives {

    Rendered renderLayout(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderGroup(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderText(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderNumber(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderLabel(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderDate(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderDatePart(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderChoose(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderIf(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderElseIf(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderElse(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    /** Renders a macro body. Macros carry no attributes, so {@code attributes} is always empty. */
    Rendered renderMacro(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    /** Renders the sort keys of a {@code sort} element, one child per key. */
    Rendered renderSort(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    Rendered renderKey(Map<String, String> attributes, RenderContext context, List<RenderFn> children);

    /**
     * Renders the name variables of a {@code names} element.
     *
     * @param spec    the variables plus the {@code name}, {@code et-al} and {@code label} settings
     * @param context the current rendering context
     * @return the rendered names; empty when none of the variables has a value
     */
    Rendered renderNameVars(NamesSpec spec, RenderContext context);

    /**
     * Counts the names contained in rendered names output.
     *
     * @param rendered a value previously returned by {@link #renderNameVars}
     * @return the number of names, {@code 0} for empty output
     */
    int countNames(Rendered rendered);
}

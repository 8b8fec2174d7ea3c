package io.citestyle.core.model;

import io.citestyle.core.spi.RenderFn;
import java.util.List;
import java.util.Objects;

/**
 * A compiled {@code sort} element.
 *
 * @param render    renders the sort keys of one entry
 * @param ascending one flag per {@code key}, in document order; {@code true} means ascending
 */
public record CompiledSort(RenderFn render, List<Boolean> ascending) {

    public CompiledSort {
        Objects.requireNonNull(render, "render must not be null");
        ascending = ascending != null ? List.copyOf(ascending) : List.of();
    }

    public int keyCount() {
        return ascending.size();
    }
}

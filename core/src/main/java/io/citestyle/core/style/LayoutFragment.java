package io.citestyle.core.style;

import io.citestyle.core.model.CompiledLayout;
import io.citestyle.core.model.CompiledSort;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A compiled {@code citation} or {@code bibliography} element.
 *
 * @param options the element's own attributes, used as citation or bibliography options
 * @param layout  the compiled layout with its attributes
 * @param sort    the compiled sort specification, or {@code null} if the element has none
 */
public record LayoutFragment(Map<String, String> options, CompiledLayout layout, CompiledSort sort) {

    public LayoutFragment {
        Objects.requireNonNull(layout, "layout must not be null");
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }

    public Optional<CompiledSort> sortSpec() {
        return Optional.ofNullable(sort);
    }
}

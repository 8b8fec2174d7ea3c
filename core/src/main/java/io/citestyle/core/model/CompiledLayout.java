package io.citestyle.core.model;

import io.citestyle.core.spi.RenderFn;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled {@code layout} element together with its own attributes.
 *
 * @param render     the compiled layout
 * @param attributes the layout element's attributes (affixes, formatting, {@code delimiter})
 */
public record CompiledLayout(RenderFn render, Map<String, String> attributes) {

    public CompiledLayout {
        Objects.requireNonNull(render, "render must not be null");
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    /** The layout delimiter, or {@code null} if the layout declares none. */
    public String delimiter() {
        return attributes.get("delimiter");
    }
}

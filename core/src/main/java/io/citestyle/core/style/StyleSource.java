package io.citestyle.core.style;

import io.citestyle.core.model.StyleNode;
import java.util.Objects;

/**
 * Result of reading a style: the comment-free element tree plus flags taken from the raw text.
 *
 * @param origin            the style path, or {@link StyleReader#INLINE} for inline XML
 * @param usesYearSuffixVar {@code true} if the raw text references the {@code year-suffix} variable
 * @param root              the root element, comments stripped
 */
public record StyleSource(String origin, boolean usesYearSuffixVar, StyleNode root) {

    public StyleSource {
        Objects.requireNonNull(origin, "origin must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }
}

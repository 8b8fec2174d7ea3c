package io.citestyle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A localized date format taken from a locale {@code date} element.
 *
 * @param attributes the {@code date} element's attributes ({@code form}, {@code delimiter}, ...)
 * @param parts      date-part name ({@code year}, {@code month}, {@code day}) to that part's
 *                   attributes, in document order
 */
public record DateFormat(Map<String, String> attributes, Map<String, Map<String, String>> parts) {

    /** Canonical constructor with defensive copies. */
    public DateFormat {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (parts != null) {
            parts.forEach((name, attrs) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(attrs))));
        }
        parts = Collections.unmodifiableMap(copy);
    }

    /** Returns {@code true} for the textual form ({@code form="text"}). */
    public boolean isText() {
        return "text".equals(attributes.get("form"));
    }
}

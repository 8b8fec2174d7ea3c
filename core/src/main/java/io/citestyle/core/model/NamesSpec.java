package io.citestyle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@code names} element hands to the runtime's name renderer, fixed at compile time.
 *
 * @param variables        the name variables to render, in order
 * @param namesAttributes  attributes of the {@code names} element itself (delimiter, affixes, ...)
 * @param nameAttributes   attributes of the {@code name} child
 * @param nameParts        name-part name ({@code given}, {@code family}) to its attributes, in
 *                         document order
 * @param etAlAttributes   attributes of the {@code et-al} child
 * @param labelAttributes  attributes of the {@code label} child
 * @param labelBeforeNames {@code true} if the label is rendered before the names
 */
public record NamesSpec(
        List<String> variables,
        Map<String, String> namesAttributes,
        Map<String, String> nameAttributes,
        Map<String, Map<String, String>> nameParts,
        Map<String, String> etAlAttributes,
        Map<String, String> labelAttributes,
        boolean labelBeforeNames) {

    /** Canonical constructor with defensive copies. */
    public NamesSpec {
        variables = variables != null ? List.copyOf(variables) : List.of();
        namesAttributes = copy(namesAttributes);
        nameAttributes = copy(nameAttributes);
        etAlAttributes = copy(etAlAttributes);
        labelAttributes = copy(labelAttributes);
        Map<String, Map<String, String>> parts = new LinkedHashMap<>();
        if (nameParts != null) {
            nameParts.forEach((part, attrs) -> parts.put(part, copy(attrs)));
        }
        nameParts = Collections.unmodifiableMap(parts);
    }

    /** Returns {@code true} if the {@code name} child requests {@code form="count"}. */
    public boolean countForm() {
        return "count".equals(nameAttributes.get("form"));
    }

    /**
     * Returns a spec for other variables that keeps this spec's {@code name}, {@code et-al} and
     * {@code label} settings.
     */
    public NamesSpec forVariables(List<String> otherVariables, Map<String, String> otherNamesAttributes) {
        return new NamesSpec(
                otherVariables,
                otherNamesAttributes,
                nameAttributes,
                nameParts,
                etAlAttributes,
                labelAttributes,
                labelBeforeNames);
    }

    private static Map<String, String> copy(Map<String, String> map) {
        return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
    }
}

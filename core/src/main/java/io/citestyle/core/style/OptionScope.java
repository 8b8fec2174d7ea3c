package io.citestyle.core.style;

import io.citestyle.core.model.CompiledStyle;
import io.citestyle.core.model.OptionMap;

/** The four option mappings of a style, keyed as in {@code style-option-defaults.yaml}. */
public enum OptionScope {
    STYLE("style"),
    CITATION("citation"),
    BIBLIOGRAPHY("bibliography"),
    LOCALE("locale");

    private final String key;

    OptionScope(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** Returns the builder's mapping for this scope. */
    public OptionMap of(CompiledStyle.Builder style) {
        return switch (this) {
            case STYLE -> style.options();
            case CITATION -> style.citeOptions();
            case BIBLIOGRAPHY -> style.bibOptions();
            case LOCALE -> style.localeOptions();
        };
    }
}

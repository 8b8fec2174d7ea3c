package io.citestyle.core.compiler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of CSL element tags the compiler understands. Tags outside this set are rejected
 * wherever they would have to be dispatched.
 */
public enum ElementTag {
    // style structure
    STYLE("style"),
    INFO("info"),
    LOCALE("locale"),
    CITATION("citation"),
    BIBLIOGRAPHY("bibliography"),
    MACRO("macro"),

    // locale content
    STYLE_OPTIONS("style-options"),
    TERMS("terms"),

    // rendering elements
    LAYOUT("layout"),
    GROUP("group"),
    TEXT("text"),
    NUMBER("number"),
    LABEL("label"),
    DATE("date"),
    DATE_PART("date-part"),
    CHOOSE("choose"),
    IF("if"),
    ELSE_IF("else-if"),
    ELSE("else"),
    NAMES("names"),
    NAME("name"),
    NAME_PART("name-part"),
    ET_AL("et-al"),
    SUBSTITUTE("substitute"),
    SORT("sort"),
    KEY("key");

    private static final Map<String, ElementTag> BY_NAME = new HashMap<>();

    static {
        for (ElementTag tag : values()) {
            BY_NAME.put(tag.xmlName, tag);
        }
    }

    private final String xmlName;

    ElementTag(String xmlName) {
        this.xmlName = xmlName;
    }

    /** The element name as written in CSL. */
    public String xmlName() {
        return xmlName;
    }

    /** Resolves an element name; empty for tags outside the known set. */
    public static Optional<ElementTag> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}

package io.citestyle.core.model;

import java.util.Collection;

/**
 * Value produced by a render function: runtime-specific content plus the variable status the
 * rendering runtime uses for group suppression.
 *
 * @param content     rendered content (plain string or runtime rich text), {@code null} if nothing
 *                    was rendered
 * @param status      whether variables were involved and whether any of them had a value
 * @param substituted {@code true} when the content came from a {@code names} substitution
 */
public record Rendered(Object content, VarStatus status, boolean substituted) {

    /** Variable status of a rendered value. */
    public enum VarStatus {
        /** Only literal text was rendered, no variable was consulted. */
        TEXT_ONLY,
        /** At least one variable was consulted and had a value. */
        PRESENT_VAR,
        /** Variables were consulted but all of them were empty. */
        EMPTY_VARS
    }

    private static final Rendered EMPTY_VARS = new Rendered(null, VarStatus.EMPTY_VARS, false);

    public Rendered {
        status = status != null ? status : VarStatus.TEXT_ONLY;
    }

    /** A literal text value. */
    public static Rendered text(String value) {
        return new Rendered(value, VarStatus.TEXT_ONLY, false);
    }

    /** A value rendered from at least one non-empty variable. */
    public static Rendered presentVar(Object content) {
        return new Rendered(content, VarStatus.PRESENT_VAR, false);
    }

    /** The empty result of a rendering whose variables were all empty. */
    public static Rendered emptyVars() {
        return EMPTY_VARS;
    }

    /** Returns {@code true} if nothing visible was rendered. */
    public boolean isEmpty() {
        if (content == null) {
            return true;
        }
        if (content instanceof CharSequence chars) {
            return chars.length() == 0;
        }
        if (content instanceof Collection<?> items) {
            return items.isEmpty();
        }
        return false;
    }

    /** Returns a copy carrying the substitution marker. */
    public Rendered asSubstituted() {
        return substituted ? this : new Rendered(content, status, true);
    }

    /** Returns a copy with different content and the same status and marker. */
    public Rendered withContent(Object newContent) {
        return new Rendered(newContent, status, substituted);
    }
}

package io.citestyle.core.error;

/**
 * Thrown when a style fragment does not have the shape the compiler requires, e.g. a {@code citation}
 * without a {@code layout} child or a {@code names} element without a variable.
 */
public final class StyleStructureException extends StyleException {

    private static final long serialVersionUID = 1L;

    public StyleStructureException(String message, String source) {
        super(message, source, Kind.STRUCTURE);
    }

    public StyleStructureException(String message, Throwable cause, String source) {
        super(message, cause, source, Kind.STRUCTURE);
    }
}

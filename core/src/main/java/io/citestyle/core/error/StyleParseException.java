package io.citestyle.core.error;

/** Thrown when style or locale text is not well-formed XML. */
public final class StyleParseException extends StyleException {

    private static final long serialVersionUID = 1L;

    public StyleParseException(String message, String source) {
        super(message, source, Kind.PARSE);
    }

    public StyleParseException(String message, Throwable cause, String source) {
        super(message, cause, source, Kind.PARSE);
    }
}

package io.citestyle.core.error;

/** Thrown when a style or locale identifier can be neither parsed as inline XML nor read from disk. */
public final class StyleInputException extends StyleException {

    private static final long serialVersionUID = 1L;

    public StyleInputException(String message, String source) {
        super(message, source, Kind.INPUT);
    }

    public StyleInputException(String message, Throwable cause, String source) {
        super(message, cause, source, Kind.INPUT);
    }
}

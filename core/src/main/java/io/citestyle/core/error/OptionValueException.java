package io.citestyle.core.error;

/** Thrown when a recognized option value cannot be converted to its typed form. */
public final class OptionValueException extends StyleException {

    private static final long serialVersionUID = 1L;

    public OptionValueException(String message, String source) {
        super(message, source, Kind.OPTION_VALUE);
    }

    public OptionValueException(String message, Throwable cause, String source) {
        super(message, cause, source, Kind.OPTION_VALUE);
    }
}

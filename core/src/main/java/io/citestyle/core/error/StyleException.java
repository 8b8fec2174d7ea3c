package io.citestyle.core.error;

/**
 * Abstract base for all style compilation failures. Never thrown directly; use one of the
 * concrete subclasses. Every kind is fatal: the compilation that raised it is abandoned and no
 * partially built style escapes.
 */
public abstract class StyleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The category of failure. */
    public enum Kind {
        /** The style identifier is neither inline XML nor a readable path. */
        INPUT,
        /** The XML text is malformed. */
        PARSE,
        /** A fragment lacks required children or uses an element where it is not allowed. */
        STRUCTURE,
        /** A recognized option holds a value outside its accepted domain. */
        OPTION_VALUE
    }

    private final String source;
    private final Kind kind;

    protected StyleException(String message, String source, Kind kind) {
        super(message);
        this.source = source;
        this.kind = kind;
    }

    protected StyleException(String message, Throwable cause, String source, Kind kind) {
        super(message, cause);
        this.source = source;
        this.kind = kind;
    }

    /** The file path, {@code <inline>}, or {@code null} if the origin is not known. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The failure category. */
    public Kind kind() {
        return kind;
    }
}

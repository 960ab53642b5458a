package de.bycsitsm.icsjson.ical;

/**
 * Exception thrown when iCalendar data cannot be decoded. Every decode error is
 * fatal, so callers never receive a partially decoded calendar together with it.
 */
public class IcalException extends RuntimeException {

    /**
     * The kind of failure.
     */
    public enum Kind {
        /** The {@code BEGIN}/{@code END} envelope is missing, mismatched or truncated. */
        STRUCTURE,
        /** A physical line is blank or too long, or a logical line has no colon. */
        LINE_FORMAT,
        /** A property value does not have the required format. */
        VALUE_FORMAT,
        /** The input could not be read. */
        IO
    }

    private final Kind kind;

    public IcalException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IcalException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

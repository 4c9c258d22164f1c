package io.tabula.core;

/**
 * Unchecked failure raised by every table, series, index and grouping operation.
 * <p>
 * Failures are detected before any state is changed, so the operands of a failed call
 * are left exactly as they were.
 */
public class TabulaException extends RuntimeException {

    private final ErrorKind kind;

    public TabulaException(ErrorKind kind, String message) {
        super(message);
        this.kind = requireKind(kind);
    }

    public TabulaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireKind(kind);
    }

    public ErrorKind kind() {
        return kind;
    }

    public static TabulaException lengthMismatch(String what, long expected, long actual) {
        return new TabulaException(ErrorKind.LENGTH_MISMATCH,
                what + " length mismatch: expected " + expected + " but was " + actual);
    }

    public static TabulaException unknownLabel(Object label) {
        return new TabulaException(ErrorKind.UNKNOWN_LABEL, "label not found: " + label);
    }

    public static TabulaException ambiguousLabel(Object label, int matches) {
        return new TabulaException(ErrorKind.AMBIGUOUS_LABEL,
                "label " + label + " matches " + matches + " positions");
    }

    public static TabulaException outOfBounds(long position, long size) {
        return new TabulaException(ErrorKind.OUT_OF_BOUNDS,
                "position out of range: " + position + " (size " + size + ")");
    }

    public static TabulaException groupNotFound(Object key) {
        return new TabulaException(ErrorKind.GROUP_NOT_FOUND, "group not found: " + key);
    }

    private static ErrorKind requireKind(ErrorKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        return kind;
    }
}

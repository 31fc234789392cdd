package com.ciro.jprops;

/**
 * Fallo tipado dentro del motor. Nunca cruza la fachada {@link PropertyEngine}:
 * allí se convierte en {@link PropertyResult#failure(ErrorKind, String)}.
 */
public class PropertyException extends RuntimeException {

    private final ErrorKind kind;

    public PropertyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static PropertyException invalidPath(String fmt, Object... args) {
        return new PropertyException(ErrorKind.INVALID_PATH, String.format(fmt, args));
    }

    public static PropertyException notFound(String fmt, Object... args) {
        return new PropertyException(ErrorKind.NOT_FOUND, String.format(fmt, args));
    }

    public static PropertyException outOfRange(String fmt, Object... args) {
        return new PropertyException(ErrorKind.OUT_OF_RANGE, String.format(fmt, args));
    }

    public static PropertyException typeMismatch(String fmt, Object... args) {
        return new PropertyException(ErrorKind.TYPE_MISMATCH, String.format(fmt, args));
    }

    public static PropertyException unsupported(String fmt, Object... args) {
        return new PropertyException(ErrorKind.UNSUPPORTED, String.format(fmt, args));
    }
}

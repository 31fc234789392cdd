package com.ciro.jprops;

import java.util.Objects;
import java.util.function.Function;

/**
 * Resultado etiquetado de una operación del motor: valor o error, nunca ambos.
 */
public final class PropertyResult<T> {

    public record PropertyError(ErrorKind kind, String message) {}

    private final T value;
    private final PropertyError error;

    private PropertyResult(T value, PropertyError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> PropertyResult<T> success(T value) {
        return new PropertyResult<>(value, null);
    }

    public static PropertyResult<Void> ok() {
        return new PropertyResult<>(null, null);
    }

    public static <T> PropertyResult<T> failure(ErrorKind kind, String message) {
        return new PropertyResult<>(null, new PropertyError(Objects.requireNonNull(kind), message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** @throws IllegalStateException si el resultado es un fallo */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error.kind() + " " + error.message());
        }
        return value;
    }

    public PropertyError error() {
        return error;
    }

    public <R> PropertyResult<R> map(Function<? super T, ? extends R> fn) {
        if (error != null) return new PropertyResult<>(null, error);
        return new PropertyResult<>(fn.apply(value), null);
    }

    @Override
    public String toString() {
        return isSuccess() ? "PropertyResult[ok " + value + "]" : "PropertyResult[" + error + "]";
    }
}

package com.ciro.jprops.edit;

import com.ciro.jprops.codec.ExternalValue;

import java.util.Objects;

/**
 * Una edición estructural de lista. {@code index} es null si la operación no lo usa
 * (o si el llamador lo olvidó: el editor lo rechaza con TYPE_MISMATCH).
 */
public record CollectionOperation(CollectionOpKind kind, Integer index, ExternalValue payload) {

    public CollectionOperation {
        Objects.requireNonNull(kind, "kind");
        if (payload == null) payload = ExternalValue.absent();
    }

    public static CollectionOperation clear() {
        return new CollectionOperation(CollectionOpKind.CLEAR, null, null);
    }

    public static CollectionOperation set(ExternalValue items) {
        return new CollectionOperation(CollectionOpKind.SET, null, items);
    }

    public static CollectionOperation append(ExternalValue items) {
        return new CollectionOperation(CollectionOpKind.APPEND, null, items);
    }

    public static CollectionOperation insert(int index, ExternalValue item) {
        return new CollectionOperation(CollectionOpKind.INSERT, index, item);
    }

    public static CollectionOperation updateAt(int index, ExternalValue item) {
        return new CollectionOperation(CollectionOpKind.UPDATE_AT, index, item);
    }

    public static CollectionOperation removeAt(int index) {
        return new CollectionOperation(CollectionOpKind.REMOVE_AT, index, null);
    }
}

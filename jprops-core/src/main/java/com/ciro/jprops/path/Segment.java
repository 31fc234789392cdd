package com.ciro.jprops.path;

import java.util.Objects;

/**
 * Un paso de la ruta. {@code index} solo tiene sentido en NUMERIC y {@code key} en KEYED.
 */
public record Segment(String name, IndexKind indexKind, int index, String key) {

    public Segment {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(indexKind, "indexKind");
    }

    public static Segment plain(String name) {
        return new Segment(name, IndexKind.NONE, -1, null);
    }

    public static Segment numeric(String name, int index) {
        return new Segment(name, IndexKind.NUMERIC, index, null);
    }

    public static Segment keyed(String name, String key) {
        return new Segment(name, IndexKind.KEYED, -1, key);
    }

    public boolean hasIndex() {
        return indexKind != IndexKind.NONE;
    }

    /** Texto del índice tal como se escribió; null si no hay índice */
    public String indexText() {
        return switch (indexKind) {
            case NONE -> null;
            case NUMERIC -> Integer.toString(index);
            case KEYED -> key;
        };
    }

    @Override
    public String toString() {
        return hasIndex() ? name + "[" + indexText() + "]" : name;
    }
}

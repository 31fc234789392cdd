package com.ciro.jprops.edit;

import java.util.Locale;

public enum CollectionOpKind {
    CLEAR,
    SET,
    APPEND,
    INSERT,
    UPDATE_AT,
    REMOVE_AT;

    /** Acepta "updateAt", "update_at" o "UPDATE_AT" */
    public static CollectionOpKind parse(String text) {
        String s = text.trim().replace("_", "").toLowerCase(Locale.ROOT);
        for (CollectionOpKind k : values()) {
            if (k.name().replace("_", "").toLowerCase(Locale.ROOT).equals(s)) return k;
        }
        throw new IllegalArgumentException("Unknown collection operation '" + text
                + "'; expected clear, set, append, insert, updateAt or removeAt");
    }

    public boolean needsIndex() {
        return this == INSERT || this == UPDATE_AT || this == REMOVE_AT;
    }
}

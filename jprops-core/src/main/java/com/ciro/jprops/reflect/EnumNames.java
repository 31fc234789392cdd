package com.ciro.jprops.reflect;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Nombres de constantes de enum, sin los centinelas de fin ("MAX", "X_MAX"). */
public final class EnumNames {

    private EnumNames() {}

    public static boolean isSentinel(String name) {
        return name.equals("MAX") || name.endsWith("_MAX");
    }

    public static List<String> names(Class<? extends Enum<?>> type) {
        List<String> out = new ArrayList<>();
        for (Enum<?> e : type.getEnumConstants()) {
            if (!isSentinel(e.name())) out.add(e.name());
        }
        return out;
    }

    /** Coincidencia exacta */
    public static Optional<Enum<?>> exact(Class<? extends Enum<?>> type, String text) {
        for (Enum<?> e : type.getEnumConstants()) {
            if (e.name().equals(text)) return Optional.of(e);
        }
        return Optional.empty();
    }

    /**
     * Exacta primero; después ignora mayúsculas y guiones bajos,
     * así "RoundedBox" encuentra ROUNDED_BOX.
     */
    public static Optional<Enum<?>> lenient(Class<? extends Enum<?>> type, String text) {
        Optional<Enum<?>> hit = exact(type, text);
        if (hit.isPresent()) return hit;
        String wanted = squash(text);
        for (Enum<?> e : type.getEnumConstants()) {
            if (!isSentinel(e.name()) && squash(e.name()).equals(wanted)) return Optional.of(e);
        }
        return Optional.empty();
    }

    private static String squash(String s) {
        return s.replace("_", "").toLowerCase(Locale.ROOT);
    }
}

package com.ciro.jprops.codec;

import com.ciro.jprops.types.LinearColor;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

final class NamedColors {

    private static final Map<String, LinearColor> COLORS = Map.ofEntries(
            Map.entry("white", new LinearColor(1f, 1f, 1f, 1f)),
            Map.entry("black", new LinearColor(0f, 0f, 0f, 1f)),
            Map.entry("red", new LinearColor(1f, 0f, 0f, 1f)),
            Map.entry("green", new LinearColor(0f, 1f, 0f, 1f)),
            Map.entry("blue", new LinearColor(0f, 0f, 1f, 1f)),
            Map.entry("yellow", new LinearColor(1f, 1f, 0f, 1f)),
            Map.entry("cyan", new LinearColor(0f, 1f, 1f, 1f)),
            Map.entry("magenta", new LinearColor(1f, 0f, 1f, 1f)),
            Map.entry("orange", new LinearColor(1f, 0.5f, 0f, 1f)),
            Map.entry("purple", new LinearColor(0.5f, 0f, 0.5f, 1f)),
            Map.entry("gray", new LinearColor(0.5f, 0.5f, 0.5f, 1f)),
            Map.entry("grey", new LinearColor(0.5f, 0.5f, 0.5f, 1f)),
            Map.entry("transparent", new LinearColor(0f, 0f, 0f, 0f)));

    private NamedColors() {}

    static Optional<LinearColor> find(String name) {
        LinearColor c = COLORS.get(name.trim().toLowerCase(Locale.ROOT));
        return c == null ? Optional.empty() : Optional.of(c.copy());
    }
}

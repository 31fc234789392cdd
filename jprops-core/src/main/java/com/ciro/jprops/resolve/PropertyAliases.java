package com.ciro.jprops.resolve;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Grafías alternativas conocidas → nombre canónico del campo.
 * Inmutable: {@link #with(String, String)} devuelve una copia.
 */
public final class PropertyAliases {

    private final Map<String, String> aliases;

    private PropertyAliases(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static PropertyAliases empty() {
        return new PropertyAliases(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));
    }

    /** Alias habituales de los editores de UI */
    public static PropertyAliases defaults() {
        return empty()
                .with("IsVariable", "variable")
                .with("bIsVariable", "variable")
                .with("IsEnabled", "enabled")
                .with("bIsEnabled", "enabled")
                .with("Opacity", "renderOpacity")
                .with("ToolTip", "toolTipText");
    }

    public PropertyAliases with(String alias, String canonical) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(aliases);
        copy.put(alias, canonical);
        return new PropertyAliases(copy);
    }

    public Optional<String> canonicalFor(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    public Map<String, String> asMap() {
        return aliases;
    }
}

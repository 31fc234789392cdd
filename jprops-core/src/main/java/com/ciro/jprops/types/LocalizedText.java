package com.ciro.jprops.types;

/**
 * Texto localizable. El motor solo lee y escribe {@code source}; namespace y key
 * los asigna la herramienta de localización.
 */
public record LocalizedText(String namespace, String key, String source) {

    public static LocalizedText of(String source) {
        return new LocalizedText("", "", source == null ? "" : source);
    }

    @Override
    public String toString() {
        return source;
    }
}

package com.ciro.jprops.reflect;

import com.ciro.jprops.PropertyException;

/**
 * Construye la clave nativa de un mapa a partir del texto del segmento
 * ({@code Labels[Title]}, {@code Scores[3]}). Sin coerciones flexibles: las claves
 * se comparan con {@code equals}.
 */
public final class MapKeys {

    private MapKeys() {}

    public static Object fromText(FieldDescriptor keyType, String text) {
        Class<?> raw = keyType.rawType();
        try {
            return switch (keyType.category()) {
                case STRING -> text;
                case INT -> {
                    if (raw == long.class || raw == Long.class) yield Long.valueOf(text);
                    if (raw == short.class || raw == Short.class) yield Short.valueOf(text);
                    yield Integer.valueOf(text);
                }
                case BYTE -> {
                    int v = Integer.parseInt(text);
                    if (v < 0 || v > 255) {
                        throw PropertyException.typeMismatch("Map key '%s' is not a byte (0-255)", text);
                    }
                    yield (byte) v;
                }
                case BOOL -> {
                    if (!text.equals("true") && !text.equals("false")) {
                        throw PropertyException.typeMismatch("Map key '%s' is not a boolean", text);
                    }
                    yield Boolean.valueOf(text);
                }
                case ENUM -> EnumNames.exact(keyType.enumType(), text)
                        .orElseThrow(() -> PropertyException.typeMismatch(
                                "Map key '%s' is not a value of %s", text, raw.getSimpleName()));
                default -> throw PropertyException.unsupported(
                        "Unsupported map key type %s", keyType.genericType().getTypeName());
            };
        } catch (NumberFormatException e) {
            throw PropertyException.typeMismatch("Map key '%s' is not a valid %s", text, raw.getSimpleName());
        }
    }

    public static String toText(Object key) {
        if (key instanceof Enum<?> e) return e.name();
        if (key instanceof Byte b) return String.valueOf(Byte.toUnsignedInt(b));
        return String.valueOf(key);
    }
}

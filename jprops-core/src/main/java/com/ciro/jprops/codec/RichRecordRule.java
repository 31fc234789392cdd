package com.ciro.jprops.codec;

import com.ciro.jprops.PropertyException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Conversión a medida para un tipo struct conocido (colores, vectores, brushes...).
 * Se prueba antes que la conversión genérica campo a campo.
 * <p>
 * Nunca modifica {@code current}: devuelve una instancia nueva, o lanza
 * {@link PropertyException} TYPE_MISMATCH si la forma no le sirve.
 */
public interface RichRecordRule {

    Class<?> type();

    Object fromNode(JsonNode node, Object current);

    default Object fromString(String text, Object current) {
        throw PropertyException.typeMismatch("%s does not accept the plain string '%s'",
                type().getSimpleName(), text);
    }

    /** Forma canónica de lectura; null para usar la lectura genérica */
    default JsonNode toNode(Object value) {
        return null;
    }
}

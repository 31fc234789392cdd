package com.ciro.jprops.spi;

import com.ciro.jprops.reflect.FieldDescriptor;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;

/**
 * Fuente de metadatos de tipos. La implementación por defecto usa reflexión;
 * el runtime JVM la envuelve con una caché.
 */
public interface TypeReflection {

    /** Campos direccionables del tipo, incluidos los heredados (primero los de la subclase) */
    List<FieldDescriptor> fields(Class<?> type);

    /** Descriptor para un tipo sin campo propio: elementos, claves, propiedades virtuales */
    FieldDescriptor describe(String name, Type type);

    /** Nombre exacto primero; si {@code ignoreCase}, luego sin distinguir mayúsculas */
    default Optional<FieldDescriptor> findField(Class<?> type, String name, boolean ignoreCase) {
        List<FieldDescriptor> all = fields(type);
        for (FieldDescriptor d : all) {
            if (d.name().equals(name)) return Optional.of(d);
        }
        if (ignoreCase) {
            for (FieldDescriptor d : all) {
                if (d.name().equalsIgnoreCase(name)) return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}

package com.ciro.jprops.schema;

import com.ciro.jprops.annotations.Struct;
import com.ciro.jprops.reflect.FieldDescriptor;

/** Etiquetas de tipo legibles: "float", "Enum<Visibility>", "Array<Struct<LinearColor>>"... */
public final class TypeLabels {

    private TypeLabels() {}

    public static String of(FieldDescriptor d) {
        Class<?> raw = d.rawType();
        return switch (d.category()) {
            case BOOL -> "bool";
            case INT -> (raw == long.class || raw == Long.class) ? "int64" : "int";
            case FLOAT -> (raw == double.class || raw == Double.class) ? "double" : "float";
            case BYTE -> "byte";
            case STRING -> "String";
            case TEXT -> "Text";
            case BYTE_ENUM, ENUM -> "Enum<" + d.enumType().getSimpleName() + ">";
            case OBJECT -> "Object<" + raw.getSimpleName() + ">";
            case RECORD -> "Struct<" + structName(raw) + ">";
            case LIST -> "Array<" + of(d.elementType()) + ">";
            case SET -> "Set<" + of(d.elementType()) + ">";
            case MAP -> "Map<" + of(d.keyType()) + "," + of(d.valueType()) + ">";
            case UNSUPPORTED -> d.genericType().getTypeName();
        };
    }

    public static String structName(Class<?> type) {
        Struct s = type.getAnnotation(Struct.class);
        return s == null || s.value().isBlank() ? type.getSimpleName() : s.value();
    }
}

package com.ciro.jprops.reflect;

/** Clasificación de un campo que decide cómo se recorre, convierte y describe. */
public enum FieldCategory {
    BOOL,
    INT,
    FLOAT,
    BYTE,
    STRING,
    /** {@link com.ciro.jprops.types.LocalizedText} */
    TEXT,
    /** byte que guarda el ordinal de un enum ({@link com.ciro.jprops.annotations.EnumAsByte}) */
    BYTE_ENUM,
    ENUM,
    /** referencia a otro objeto; se recorre por su clase en tiempo de ejecución */
    OBJECT,
    /** tipo {@link com.ciro.jprops.annotations.Struct}, embebido por valor */
    RECORD,
    LIST,
    SET,
    MAP,
    UNSUPPORTED;

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == BYTE;
    }

    public boolean isCollection() {
        return this == LIST || this == SET || this == MAP;
    }

    /** Solo los compuestos admiten más segmentos detrás */
    public boolean isTraversable() {
        return this == RECORD || this == OBJECT;
    }
}

package com.ciro.jprops.path;

public enum IndexKind {
    NONE,
    /** {@code name[3]} */
    NUMERIC,
    /** {@code name[Key]}: texto literal, se interpreta según el tipo de clave del mapa */
    KEYED
}

package com.ciro.jprops;

/** Taxonomía de fallos que el motor devuelve al llamador. */
public enum ErrorKind {
    /** Sintaxis de ruta inválida, o forma de segmento incompatible con la categoría */
    INVALID_PATH,
    /** Nombre de campo o propiedad virtual inexistente, o referencia nula en el camino */
    NOT_FOUND,
    /** Índice fuera de rango o clave de mapa inexistente */
    OUT_OF_RANGE,
    /** El valor no se puede convertir al tipo del campo */
    TYPE_MISMATCH,
    /** Categoría o operación no soportada sobre el destino */
    UNSUPPORTED
}

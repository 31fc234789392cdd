package com.ciro.jprops.spi;

/**
 * Lo que el motor necesita saber del modelo de objetos anfitrión.
 * El motor nunca es dueño de las entidades: solo las consulta por aquí.
 */
public interface EntityModel {

    /** Slot que une la entidad a su contenedor, o null si no tiene */
    Object attachmentOf(Object entity);

    /** Documento que contiene la entidad; destino de las notificaciones */
    Object documentOf(Object entity);

    /** Posición entre sus hermanos, o -1 si no tiene contenedor */
    int siblingIndex(Object entity);

    /** Número de hijos del contenedor, o 0 si no tiene contenedor */
    int siblingCount(Object entity);

    /** Mueve la entidad a {@code index}, ya acotado a [0, count-1] */
    void moveToIndex(Object entity, int index);
}

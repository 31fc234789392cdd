package com.ciro.jprops.resolve;

/** Dirección de almacenamiento concreta: un campo de un objeto, un elemento, un valor de mapa. */
public interface Location {

    Object get();

    void set(Object value);
}

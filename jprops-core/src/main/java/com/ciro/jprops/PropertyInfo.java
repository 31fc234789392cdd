package com.ciro.jprops;

/** Entrada del listado de propiedades de una entidad. */
public record PropertyInfo(String path, String type, String category, boolean editable) {}

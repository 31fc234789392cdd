package com.ciro.jprops.model;

/** Recurso de imagen cargado; lo referencian los brushes. */
public record Texture2D(String path, int width, int height) {}

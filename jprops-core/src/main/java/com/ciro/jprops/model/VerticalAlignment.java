package com.ciro.jprops.model;

public enum VerticalAlignment {
    FILL,
    TOP,
    CENTER,
    BOTTOM
}

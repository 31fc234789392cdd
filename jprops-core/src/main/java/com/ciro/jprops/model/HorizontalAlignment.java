package com.ciro.jprops.model;

public enum HorizontalAlignment {
    FILL,
    LEFT,
    CENTER,
    RIGHT
}

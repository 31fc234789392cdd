package com.ciro.jprops.types;

public enum BrushDrawType {
    NO_DRAW_TYPE,
    BOX,
    BORDER,
    IMAGE,
    ROUNDED_BOX
}

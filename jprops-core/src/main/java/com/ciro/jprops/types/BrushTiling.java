package com.ciro.jprops.types;

public enum BrushTiling {
    NO_TILE,
    HORIZONTAL,
    VERTICAL,
    BOTH
}

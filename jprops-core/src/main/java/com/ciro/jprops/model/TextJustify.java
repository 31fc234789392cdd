package com.ciro.jprops.model;

public enum TextJustify {
    LEFT,
    CENTER,
    RIGHT
}

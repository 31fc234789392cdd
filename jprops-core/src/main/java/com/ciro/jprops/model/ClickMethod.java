package com.ciro.jprops.model;

/** Se guarda como byte en {@link Button}; el último valor es el centinela de fin. */
public enum ClickMethod {
    DOWN_AND_UP,
    MOUSE_DOWN,
    MOUSE_UP,
    PRECISE_CLICK,
    CLICK_METHOD_MAX
}

package com.ciro.jprops.model;

public enum Visibility {
    VISIBLE,
    COLLAPSED,
    HIDDEN,
    HIT_TEST_INVISIBLE,
    SELF_HIT_TEST_INVISIBLE
}

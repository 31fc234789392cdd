package com.ciro.jprops.model;

public enum SizeRule {
    AUTOMATIC,
    FILL
}

package com.ciro.jprops;

import com.ciro.jprops.codec.ExternalValue;

public record PropertyUpdate(String path, ExternalValue value) {}

package com.ciro.jprops.spi;

import java.lang.reflect.Type;

/** Propiedad de slot sin campo propio: se lee y escribe vía la familia del slot. */
public record VirtualProperty(String name, Type valueType) {}

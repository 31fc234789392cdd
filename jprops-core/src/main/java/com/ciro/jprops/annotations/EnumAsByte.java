package com.ciro.jprops.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/** Un campo {@code byte} que guarda el ordinal de un enum. */
@Retention(RUNTIME)
@Target(FIELD)
public @interface EnumAsByte {
    Class<? extends Enum<?>> value();
}

package com.ciro.jprops.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Tipo valor con sub-campos, embebido en su dueño.
 * Necesita constructor vacío: el motor crea copias antes de escribir.
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface Struct {
    /** Nombre para los esquemas; si está vacío, usa el simple name */
    String value() default "";
}

package com.ciro.jprops.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marca un campo como direccionable por ruta ("Color", "Slot.Padding", "Items[2]").
 * Los límites numéricos se declaran como texto; vacío significa "sin límite".
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Property {
    /** Nombre lógico; si está vacío, usa el nombre del campo */
    String value() default "";

    /** Etiqueta de categoría para el inspector */
    String category() default "";

    String tooltip() default "";

    boolean editable() default true;

    boolean visible() default true;

    /** El campo participa en la generación (identificadores, variables del documento) */
    boolean generative() default false;

    String clampMin() default "";
    String clampMax() default "";
    String uiMin() default "";
    String uiMax() default "";
}

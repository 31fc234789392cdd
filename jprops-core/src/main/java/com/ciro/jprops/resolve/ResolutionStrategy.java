package com.ciro.jprops.resolve;

import com.ciro.jprops.path.Segment;

import java.util.Optional;

/**
 * Vía de escape que se prueba antes de la búsqueda normal de campos.
 * Devuelve vacío si no aplica; lanza {@link com.ciro.jprops.PropertyException} si aplica pero
 * la ruta es inválida.
 */
public interface ResolutionStrategy {

    Optional<ResolvedTarget> tryResolve(ResolutionContext ctx, Segment segment);
}

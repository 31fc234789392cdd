package com.ciro.jprops.resolve;

import java.util.Optional;

/** Nombre alternativo a probar cuando la búsqueda normal no encuentra el campo. */
public interface LookupFallback {

    Optional<String> alternateName(String name);
}

package com.ciro.jprops.spi;

import java.util.Optional;

/**
 * Carga síncrona de recursos por ruta ("/Game/UI/Icon.Icon").
 * Puede lanzar RuntimeException; quien la llama decide si el fallo es fatal.
 */
public interface AssetLoader {

    Optional<Object> load(String path);

    /** Ruta de un recurso ya cargado, si se conoce */
    default Optional<String> pathOf(Object asset) {
        return Optional.empty();
    }

    AssetLoader NONE = path -> Optional.empty();
}

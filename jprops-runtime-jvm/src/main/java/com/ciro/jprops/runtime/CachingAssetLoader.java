package com.ciro.jprops.runtime;

import com.ciro.jprops.JpropsConfig;
import com.ciro.jprops.spi.AssetLoader;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Caché de recursos por ruta. Solo se guardan las cargas correctas: una ruta que no existe
 * o un fallo del loader se vuelven a intentar en la siguiente llamada.
 */
public class CachingAssetLoader implements AssetLoader {

    private static final Logger log = LoggerFactory.getLogger(CachingAssetLoader.class);

    private final AssetLoader delegate;
    private final Cache<String, Object> cache;

    public CachingAssetLoader(AssetLoader delegate, JpropsConfig config) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getAssetCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(config.getAssetCacheSize())
                .build();
    }

    @Override
    public Optional<Object> load(String path) {
        Object hit = cache.getIfPresent(path);
        if (hit != null) return Optional.of(hit);

        Optional<Object> loaded = delegate.load(path);
        loaded.ifPresent(asset -> {
            cache.put(path, asset);
            log.debug("Asset '{}' cached", path);
        });
        return loaded;
    }

    @Override
    public Optional<String> pathOf(Object asset) {
        Optional<String> known = delegate.pathOf(asset);
        if (known.isPresent()) return known;
        for (Map.Entry<String, Object> e : cache.asMap().entrySet()) {
            if (e.getValue() == asset) return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    public void invalidate(String path) {
        cache.invalidate(path);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}

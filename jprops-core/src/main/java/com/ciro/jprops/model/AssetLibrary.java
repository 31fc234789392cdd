package com.ciro.jprops.model;

import com.ciro.jprops.spi.AssetLoader;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Catálogo de recursos en memoria, indexado por ruta. */
public class AssetLibrary implements AssetLoader {

    private final Map<String, Object> assets = new LinkedHashMap<>();

    public AssetLibrary add(String path, Object asset) {
        assets.put(path, asset);
        return this;
    }

    public AssetLibrary addTexture(String path, int width, int height) {
        return add(path, new Texture2D(path, width, height));
    }

    @Override
    public Optional<Object> load(String path) {
        return Optional.ofNullable(assets.get(path));
    }

    @Override
    public Optional<String> pathOf(Object asset) {
        if (asset instanceof Texture2D t) return Optional.of(t.path());
        return assets.entrySet().stream()
                .filter(e -> e.getValue() == asset)
                .map(Map.Entry::getKey)
                .findFirst();
    }
}

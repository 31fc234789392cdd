package com.ciro.jprops.runtime;

import com.ciro.jprops.JpropsConfig;
import com.ciro.jprops.PropertyEngine;
import com.ciro.jprops.spi.AssetLoader;

/** Builder del motor con las cachés del runtime ya puestas. */
public final class JvmEngines {

    private JvmEngines() {}

    public static PropertyEngine.Builder builder(JpropsConfig config, AssetLoader assets) {
        return PropertyEngine.builder()
                .config(config)
                .typeReflection(new CachingTypeReflection(config))
                .assetLoader(new CachingAssetLoader(assets, config));
    }

    public static PropertyEngine.Builder builder(AssetLoader assets) {
        return builder(JpropsConfig.load(), assets);
    }
}

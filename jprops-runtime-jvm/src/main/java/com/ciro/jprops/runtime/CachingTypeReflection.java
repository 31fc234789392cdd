package com.ciro.jprops.runtime;

import com.ciro.jprops.JpropsConfig;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.reflect.ReflectionTypeProvider;
import com.ciro.jprops.spi.TypeReflection;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.lang.reflect.Type;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link TypeReflection} con caché Caffeine delante. Se guardan descriptores por tipo,
 * nunca objetos ni destinos resueltos.
 */
public class CachingTypeReflection implements TypeReflection {

    private record DescribeKey(String name, Type type) {}

    private final TypeReflection delegate;
    private final Cache<Class<?>, List<FieldDescriptor>> fields;
    private final Cache<DescribeKey, FieldDescriptor> described;

    public CachingTypeReflection(JpropsConfig config) {
        this(new ReflectionTypeProvider(), config);
    }

    public CachingTypeReflection(TypeReflection delegate, JpropsConfig config) {
        this.delegate = delegate;
        this.fields = Caffeine.newBuilder()
                .expireAfterAccess(config.getReflectionCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(config.getReflectionCacheSize())
                .recordStats()
                .build();
        this.described = Caffeine.newBuilder()
                .expireAfterAccess(config.getReflectionCacheTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(config.getReflectionCacheSize())
                .build();
    }

    @Override
    public List<FieldDescriptor> fields(Class<?> type) {
        return fields.get(type, delegate::fields);
    }

    @Override
    public FieldDescriptor describe(String name, Type type) {
        return described.get(new DescribeKey(name, type), k -> delegate.describe(k.name(), k.type()));
    }

    public CacheStats stats() {
        return fields.stats();
    }

    /** Tras recargar clases (hot swap) los descriptores viejos apuntan a campos muertos */
    public void invalidateAll() {
        fields.invalidateAll();
        described.invalidateAll();
    }
}

package com.ciro.jprops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Ajustes del motor y de las cachés del runtime. {@link #load()} lee
 * {@code jprops.properties} del classpath (claves con prefijo {@code jprops.}).
 */
public class JpropsConfig {

    private static final Logger log = LoggerFactory.getLogger(JpropsConfig.class);

    public static final String RESOURCE = "jprops.properties";
    private static final String PREFIX = "jprops.";

    /** Si falla el nombre exacto, buscar el campo sin distinguir mayúsculas */
    private boolean caseInsensitiveLookup = true;
    /** Claves desconocidas en un struct: error (true) o se ignoran (false) */
    private boolean strictRecordKeys = true;
    /** Máximo de clases con metadatos en caché */
    private int reflectionCacheSize = 1000;
    /** Minutos sin acceso antes de expulsar los metadatos de una clase */
    private int reflectionCacheTtlMinutes = 30;
    /** Máximo de recursos cargados en caché */
    private int assetCacheSize = 256;
    /** Minutos de vida de un recurso en caché */
    private int assetCacheTtlMinutes = 10;

    public boolean isCaseInsensitiveLookup() { return caseInsensitiveLookup; }
    public void setCaseInsensitiveLookup(boolean v) { this.caseInsensitiveLookup = v; }

    public boolean isStrictRecordKeys() { return strictRecordKeys; }
    public void setStrictRecordKeys(boolean v) { this.strictRecordKeys = v; }

    public int getReflectionCacheSize() { return reflectionCacheSize; }
    public void setReflectionCacheSize(int v) { this.reflectionCacheSize = v; }

    public int getReflectionCacheTtlMinutes() { return reflectionCacheTtlMinutes; }
    public void setReflectionCacheTtlMinutes(int v) { this.reflectionCacheTtlMinutes = v; }

    public int getAssetCacheSize() { return assetCacheSize; }
    public void setAssetCacheSize(int v) { this.assetCacheSize = v; }

    public int getAssetCacheTtlMinutes() { return assetCacheTtlMinutes; }
    public void setAssetCacheTtlMinutes(int v) { this.assetCacheTtlMinutes = v; }

    public static JpropsConfig load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JpropsConfig load(ClassLoader loader) {
        JpropsConfig cfg = new JpropsConfig();
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("{} not found, using defaults", RESOURCE);
                return cfg;
            }
            Properties p = new Properties();
            p.load(in);
            cfg.apply(p);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return cfg;
    }

    public JpropsConfig apply(Properties p) {
        caseInsensitiveLookup = bool(p, "caseInsensitiveLookup", caseInsensitiveLookup);
        strictRecordKeys = bool(p, "strictRecordKeys", strictRecordKeys);
        reflectionCacheSize = integer(p, "reflectionCacheSize", reflectionCacheSize);
        reflectionCacheTtlMinutes = integer(p, "reflectionCacheTtlMinutes", reflectionCacheTtlMinutes);
        assetCacheSize = integer(p, "assetCacheSize", assetCacheSize);
        assetCacheTtlMinutes = integer(p, "assetCacheTtlMinutes", assetCacheTtlMinutes);
        return this;
    }

    private static boolean bool(Properties p, String key, boolean def) {
        String v = p.getProperty(PREFIX + key);
        return v == null ? def : Boolean.parseBoolean(v.trim());
    }

    private static int integer(Properties p, String key, int def) {
        String v = p.getProperty(PREFIX + key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": '" + v + "'", e);
        }
    }
}

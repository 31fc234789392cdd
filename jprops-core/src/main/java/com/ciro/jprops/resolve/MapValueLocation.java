package com.ciro.jprops.resolve;

import java.util.Map;

/** Valor de un mapa bajo una clave que ya existe. */
public record MapValueLocation(Map<Object, Object> map, Object key) implements Location {

    @Override
    public Object get() {
        return map.get(key);
    }

    @Override
    public void set(Object value) {
        map.put(key, value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MapValueLocation l && l.map == map && l.key.equals(key);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(map) + key.hashCode();
    }
}

package com.ciro.jprops.resolve;

import java.lang.reflect.Field;

public record FieldLocation(Object owner, Field field) implements Location {

    @Override
    public Object get() {
        try {
            return field.get(owner);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + field.getName(), e);
        }
    }

    @Override
    public void set(Object value) {
        try {
            field.set(owner, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write " + field.getName(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldLocation l && l.owner == owner && l.field.equals(field);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(owner) + field.hashCode();
    }
}

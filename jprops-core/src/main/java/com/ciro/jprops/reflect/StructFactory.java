package com.ciro.jprops.reflect;

import com.ciro.jprops.PropertyException;
import com.ciro.jprops.spi.TypeReflection;

import java.lang.reflect.Constructor;

/**
 * Crea y copia instancias de tipos struct. La copia es profunda en los sub-structs y
 * superficial en lo demás (las referencias a objetos se comparten).
 */
public class StructFactory {

    private final TypeReflection types;

    public StructFactory(TypeReflection types) {
        this.types = types;
    }

    public <T> T create(Class<T> type) {
        try {
            Constructor<T> ctor = type.getDeclaredConstructor();
            if (!ctor.canAccess(null)) {
                ctor.setAccessible(true);
            }
            return ctor.newInstance();
        } catch (NoSuchMethodException e) {
            throw PropertyException.unsupported("Struct %s has no no-arg constructor", type.getName());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to instantiate struct: " + type.getName(), e);
        }
    }

    public Object copy(Class<?> type, Object source) {
        Object target = create(type);
        for (FieldDescriptor d : types.fields(type)) {
            try {
                Object v = d.field().get(source);
                if (v != null && d.category() == FieldCategory.RECORD) {
                    v = copy(d.rawType(), v);
                }
                d.field().set(target, v);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot copy " + type.getSimpleName() + "." + d.name(), e);
            }
        }
        return target;
    }
}

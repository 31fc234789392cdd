package com.ciro.jprops.reflect;

import com.ciro.jprops.annotations.EnumAsByte;
import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.annotations.Struct;
import com.ciro.jprops.spi.TypeReflection;
import com.ciro.jprops.types.LocalizedText;

import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link TypeReflection} basada en {@code java.lang.reflect}.
 * <ul>
 *   <li>En clases normales solo cuentan los campos con {@link Property}.</li>
 *   <li>En tipos {@link Struct} cuentan todos los campos no estáticos ni transient.</li>
 * </ul>
 * No guarda nada: cada llamada vuelve a recorrer la jerarquía.
 */
public class ReflectionTypeProvider implements TypeReflection {

    @Override
    public List<FieldDescriptor> fields(Class<?> type) {
        boolean struct = type.isAnnotationPresent(Struct.class);
        List<FieldDescriptor> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        Class<?> c = type;
        while (c != null && c != Object.class) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || f.isSynthetic()) continue;

                Property ann = f.getAnnotation(Property.class);
                if (ann == null && (!struct || Modifier.isTransient(mod))) continue;

                FieldDescriptor d = describeField(f, ann);
                // un campo de la subclase oculta al homónimo del padre
                if (!seen.add(d.name())) continue;

                f.setAccessible(true);
                out.add(d);
            }
            c = c.getSuperclass();
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public FieldDescriptor describe(String name, Type type) {
        return builderFor(name, type, null).build();
    }

    private FieldDescriptor describeField(Field f, Property ann) {
        String name = (ann == null || ann.value().isBlank()) ? f.getName() : ann.value();
        FieldDescriptor.Builder b = builderFor(name, f.getGenericType(), f.getAnnotation(EnumAsByte.class))
                .field(f);

        if (Modifier.isFinal(f.getModifiers())) b.editable(false);
        if (ann != null) {
            b.editable(ann.editable() && !Modifier.isFinal(f.getModifiers()))
             .visible(ann.visible())
             .generative(ann.generative())
             .categoryLabel(ann.category())
             .tooltip(ann.tooltip())
             .clamp(bound(ann.clampMin(), f), bound(ann.clampMax(), f))
             .ui(bound(ann.uiMin(), f), bound(ann.uiMax(), f));
        }
        return b.build();
    }

    private FieldDescriptor.Builder builderFor(String name, Type type, EnumAsByte asByte) {
        Class<?> raw = rawClass(type);
        FieldCategory cat = categorize(raw);

        if (asByte != null && cat == FieldCategory.BYTE) {
            return FieldDescriptor.builder(name, FieldCategory.BYTE_ENUM, type, raw).enumType(asByte.value());
        }

        FieldDescriptor.Builder b = FieldDescriptor.builder(name, cat, type, raw);
        switch (cat) {
            case ENUM -> b.enumType(enumClass(raw));
            case LIST, SET -> b.elementType(describe("[element]", typeArgument(type, 0)));
            case MAP -> b.keyType(describe("[key]", typeArgument(type, 0)))
                         .valueType(describe("[value]", typeArgument(type, 1)));
            default -> { }
        }
        return b;
    }

    static FieldCategory categorize(Class<?> raw) {
        if (raw == boolean.class || raw == Boolean.class) return FieldCategory.BOOL;
        if (raw == int.class || raw == Integer.class
                || raw == long.class || raw == Long.class
                || raw == short.class || raw == Short.class) return FieldCategory.INT;
        if (raw == float.class || raw == Float.class
                || raw == double.class || raw == Double.class) return FieldCategory.FLOAT;
        if (raw == byte.class || raw == Byte.class) return FieldCategory.BYTE;
        if (raw == String.class) return FieldCategory.STRING;
        if (raw == LocalizedText.class) return FieldCategory.TEXT;
        if (raw.isEnum()) return FieldCategory.ENUM;
        if (List.class.isAssignableFrom(raw)) return FieldCategory.LIST;
        if (Set.class.isAssignableFrom(raw)) return FieldCategory.SET;
        if (Map.class.isAssignableFrom(raw)) return FieldCategory.MAP;
        if (raw.isAnnotationPresent(Struct.class)) return FieldCategory.RECORD;
        if (raw.isPrimitive() || raw.isArray() || Number.class.isAssignableFrom(raw)
                || raw == Character.class) return FieldCategory.UNSUPPORTED;
        return FieldCategory.OBJECT;
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Enum<?>> enumClass(Class<?> raw) {
        return (Class<? extends Enum<?>>) raw;
    }

    private static Type typeArgument(Type type, int i) {
        if (type instanceof ParameterizedType p && p.getActualTypeArguments().length > i) {
            return p.getActualTypeArguments()[i];
        }
        return Object.class;
    }

    static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) return c;
        if (type instanceof ParameterizedType p) return rawClass(p.getRawType());
        if (type instanceof WildcardType w) {
            Type[] upper = w.getUpperBounds();
            return upper.length == 0 ? Object.class : rawClass(upper[0]);
        }
        if (type instanceof TypeVariable<?> v) {
            Type[] bounds = v.getBounds();
            return bounds.length == 0 ? Object.class : rawClass(bounds[0]);
        }
        if (type instanceof GenericArrayType) return Object[].class;
        return Object.class;
    }

    private static Double bound(String text, Field f) {
        if (text == null || text.isBlank()) return null;
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid numeric bound '" + text + "' on "
                    + f.getDeclaringClass().getSimpleName() + "." + f.getName(), e);
        }
    }
}

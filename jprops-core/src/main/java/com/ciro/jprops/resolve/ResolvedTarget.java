package com.ciro.jprops.resolve;

import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.spi.VirtualProperty;

import java.util.Objects;

/**
 * Resultado de resolver una ruta. Exactamente una variante está presente:
 * campo ({@code location} + {@code descriptor}), sintética o virtual.
 * Se construye en cada llamada y no se guarda.
 */
public record ResolvedTarget(Object entity,
                             Object root,
                             Location location,
                             FieldDescriptor descriptor,
                             SyntheticKind synthetic,
                             VirtualProperty virtualProperty,
                             String path) {

    public static ResolvedTarget field(Object entity, Object root, Location location,
                                       FieldDescriptor descriptor, String path) {
        return new ResolvedTarget(entity, root, location, descriptor, null, null, path);
    }

    public static ResolvedTarget synthetic(Object entity, Object root, SyntheticKind kind, String path) {
        return new ResolvedTarget(entity, root, null, null, kind, null, path);
    }

    public static ResolvedTarget virtual(Object entity, Object root, VirtualProperty property, String path) {
        return new ResolvedTarget(entity, root, null, null, null, property, path);
    }

    public boolean isField() {
        return descriptor != null;
    }

    public boolean isSynthetic() {
        return synthetic != null;
    }

    public boolean isVirtual() {
        return virtualProperty != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedTarget t)) return false;
        return entity == t.entity && root == t.root
                && Objects.equals(location, t.location)
                && Objects.equals(descriptor, t.descriptor)
                && synthetic == t.synthetic
                && Objects.equals(virtualProperty, t.virtualProperty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(entity), System.identityHashCode(root),
                location, descriptor, synthetic, virtualProperty);
    }
}

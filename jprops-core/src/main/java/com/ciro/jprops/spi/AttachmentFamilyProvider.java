package com.ciro.jprops.spi;

import java.util.List;
import java.util.Optional;

/**
 * Familias de slots (canvas, caja, overlay...) y sus propiedades virtuales.
 * Los valores viajan ya convertidos al {@link VirtualProperty#valueType()}.
 */
public interface AttachmentFamilyProvider {

    String familyName(Object attachment);

    List<VirtualProperty> virtualProperties(Object attachment);

    Object read(Object attachment, VirtualProperty property);

    void write(Object attachment, VirtualProperty property, Object value);

    default Optional<VirtualProperty> findVirtual(Object attachment, String name) {
        return virtualProperties(attachment).stream()
                .filter(p -> p.name().equalsIgnoreCase(name))
                .findFirst();
    }

    AttachmentFamilyProvider NONE = new AttachmentFamilyProvider() {
        @Override public String familyName(Object a) { return a == null ? "none" : a.getClass().getSimpleName(); }
        @Override public List<VirtualProperty> virtualProperties(Object a) { return List.of(); }
        @Override public Object read(Object a, VirtualProperty p) {
            throw new IllegalStateException("No virtual property " + p.name());
        }
        @Override public void write(Object a, VirtualProperty p, Object v) {
            throw new IllegalStateException("No virtual property " + p.name());
        }
    };
}

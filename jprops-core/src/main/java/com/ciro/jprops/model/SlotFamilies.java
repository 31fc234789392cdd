package com.ciro.jprops.model;

import com.ciro.jprops.spi.AttachmentFamilyProvider;
import com.ciro.jprops.spi.VirtualProperty;
import com.ciro.jprops.types.Vector2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Familias de slot del modelo por defecto y sus propiedades virtuales.
 * Un slot sin familia registrada usa la de su superclase más cercana.
 */
public final class SlotFamilies implements AttachmentFamilyProvider {

    private record Accessor(VirtualProperty property,
                            Function<Object, Object> getter,
                            BiConsumer<Object, Object> setter) {}

    public static final class Family<S> {
        private final String name;
        private final Map<String, Accessor> accessors = new LinkedHashMap<>();

        private Family(String name) {
            this.name = name;
        }

        @SuppressWarnings("unchecked")
        public <V> Family<S> virtual(String property, Class<V> type, Function<S, V> getter, BiConsumer<S, V> setter) {
            accessors.put(property.toLowerCase(Locale.ROOT), new Accessor(
                    new VirtualProperty(property, type),
                    o -> getter.apply((S) o),
                    (o, v) -> setter.accept((S) o, (V) v)));
            return this;
        }
    }

    private final Map<Class<?>, Family<?>> families = new LinkedHashMap<>();

    public static SlotFamilies defaults() {
        SlotFamilies f = new SlotFamilies();
        f.family(CanvasPanelSlot.class, "CanvasPanelSlot")
                .virtual("Position", Vector2.class, CanvasPanelSlot::getPosition, CanvasPanelSlot::setPosition)
                .virtual("Size", Vector2.class, CanvasPanelSlot::getSize, CanvasPanelSlot::setSize)
                .virtual("Anchors", Anchors.class, CanvasPanelSlot::getAnchors, CanvasPanelSlot::setAnchors)
                .virtual("Alignment", Vector2.class, CanvasPanelSlot::getAlignment, CanvasPanelSlot::setAlignment)
                .virtual("AutoSize", boolean.class, CanvasPanelSlot::isAutoSize, CanvasPanelSlot::setAutoSize)
                .virtual("ZOrder", int.class, CanvasPanelSlot::getZOrder, CanvasPanelSlot::setZOrder);
        boxAlignment(f.family(VerticalBoxSlot.class, "VerticalBoxSlot"));
        boxAlignment(f.family(HorizontalBoxSlot.class, "HorizontalBoxSlot"));
        f.family(OverlaySlot.class, "OverlaySlot")
                .virtual("HorizontalAlignment", HorizontalAlignment.class,
                        OverlaySlot::getHorizontalAlignment, OverlaySlot::setHorizontalAlignment)
                .virtual("VerticalAlignment", VerticalAlignment.class,
                        OverlaySlot::getVerticalAlignment, OverlaySlot::setVerticalAlignment);
        return f;
    }

    private static void boxAlignment(Family<? extends BoxSlot> family) {
        @SuppressWarnings("unchecked")
        Family<BoxSlot> box = (Family<BoxSlot>) family;
        box.virtual("HorizontalAlignment", HorizontalAlignment.class,
                        BoxSlot::getHorizontalAlignment, BoxSlot::setHorizontalAlignment)
           .virtual("VerticalAlignment", VerticalAlignment.class,
                        BoxSlot::getVerticalAlignment, BoxSlot::setVerticalAlignment);
    }

    @SuppressWarnings("unchecked")
    public <S> Family<S> family(Class<S> slotType, String name) {
        return (Family<S>) families.computeIfAbsent(slotType, t -> new Family<>(name));
    }

    @Override
    public String familyName(Object attachment) {
        Family<?> f = familyOf(attachment);
        return f != null ? f.name : attachment.getClass().getSimpleName();
    }

    @Override
    public List<VirtualProperty> virtualProperties(Object attachment) {
        Family<?> f = familyOf(attachment);
        if (f == null) return List.of();
        List<VirtualProperty> out = new ArrayList<>();
        for (Accessor a : f.accessors.values()) out.add(a.property());
        return out;
    }

    @Override
    public Object read(Object attachment, VirtualProperty property) {
        return accessor(attachment, property).getter().apply(attachment);
    }

    @Override
    public void write(Object attachment, VirtualProperty property, Object value) {
        accessor(attachment, property).setter().accept(attachment, value);
    }

    private Accessor accessor(Object attachment, VirtualProperty property) {
        Family<?> f = familyOf(attachment);
        Accessor a = f == null ? null : f.accessors.get(property.name().toLowerCase(Locale.ROOT));
        if (a == null) {
            throw new IllegalArgumentException("No virtual property " + property.name()
                    + " on " + familyName(attachment));
        }
        return a;
    }

    private Family<?> familyOf(Object attachment) {
        Class<?> c = attachment.getClass();
        while (c != null && c != Object.class) {
            Family<?> f = families.get(c);
            if (f != null) return f;
            c = c.getSuperclass();
        }
        return null;
    }
}

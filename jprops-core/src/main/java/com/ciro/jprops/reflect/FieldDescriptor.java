package com.ciro.jprops.reflect;

import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Metadatos de solo lectura de un campo direccionable, o de un tipo de elemento,
 * clave o valor de una colección (en ese caso {@code field} es null).
 * Los límites numéricos son null cuando el campo no los declara.
 */
public final class FieldDescriptor {

    private final String name;
    private final Field field;
    private final FieldCategory category;
    private final Type genericType;
    private final Class<?> rawType;
    private final Class<? extends Enum<?>> enumType;
    private final boolean editable;
    private final boolean visible;
    private final boolean generative;
    private final String categoryLabel;
    private final String tooltip;
    private final Double clampMin;
    private final Double clampMax;
    private final Double uiMin;
    private final Double uiMax;
    private final FieldDescriptor elementType;
    private final FieldDescriptor keyType;
    private final FieldDescriptor valueType;

    private FieldDescriptor(Builder b) {
        this.name = b.name;
        this.field = b.field;
        this.category = b.category;
        this.genericType = b.genericType;
        this.rawType = b.rawType;
        this.enumType = b.enumType;
        this.editable = b.editable;
        this.visible = b.visible;
        this.generative = b.generative;
        this.categoryLabel = b.categoryLabel;
        this.tooltip = b.tooltip;
        this.clampMin = b.clampMin;
        this.clampMax = b.clampMax;
        this.uiMin = b.uiMin;
        this.uiMax = b.uiMax;
        this.elementType = b.elementType;
        this.keyType = b.keyType;
        this.valueType = b.valueType;
    }

    public static Builder builder(String name, FieldCategory category, Type genericType, Class<?> rawType) {
        return new Builder(name, category, genericType, rawType);
    }

    public String name() { return name; }
    public Field field() { return field; }
    public FieldCategory category() { return category; }
    public Type genericType() { return genericType; }
    public Class<?> rawType() { return rawType; }
    public Class<? extends Enum<?>> enumType() { return enumType; }
    public boolean editable() { return editable; }
    public boolean visible() { return visible; }
    public boolean generative() { return generative; }
    public String categoryLabel() { return categoryLabel; }
    public String tooltip() { return tooltip; }
    public Double clampMin() { return clampMin; }
    public Double clampMax() { return clampMax; }
    public Double uiMin() { return uiMin; }
    public Double uiMax() { return uiMax; }
    public FieldDescriptor elementType() { return elementType; }
    public FieldDescriptor keyType() { return keyType; }
    public FieldDescriptor valueType() { return valueType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldDescriptor d)) return false;
        return name.equals(d.name) && category == d.category
                && Objects.equals(field, d.field) && genericType.equals(d.genericType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, field, genericType);
    }

    @Override
    public String toString() {
        return "FieldDescriptor[" + name + ":" + category + " " + genericType.getTypeName() + "]";
    }

    public static final class Builder {
        private final String name;
        private final FieldCategory category;
        private final Type genericType;
        private final Class<?> rawType;
        private Field field;
        private Class<? extends Enum<?>> enumType;
        private boolean editable = true;
        private boolean visible = true;
        private boolean generative;
        private String categoryLabel = "";
        private String tooltip = "";
        private Double clampMin;
        private Double clampMax;
        private Double uiMin;
        private Double uiMax;
        private FieldDescriptor elementType;
        private FieldDescriptor keyType;
        private FieldDescriptor valueType;

        private Builder(String name, FieldCategory category, Type genericType, Class<?> rawType) {
            this.name = Objects.requireNonNull(name);
            this.category = Objects.requireNonNull(category);
            this.genericType = Objects.requireNonNull(genericType);
            this.rawType = Objects.requireNonNull(rawType);
        }

        public Builder field(Field f) { this.field = f; return this; }
        public Builder enumType(Class<? extends Enum<?>> t) { this.enumType = t; return this; }
        public Builder editable(boolean v) { this.editable = v; return this; }
        public Builder visible(boolean v) { this.visible = v; return this; }
        public Builder generative(boolean v) { this.generative = v; return this; }
        public Builder categoryLabel(String v) { this.categoryLabel = v; return this; }
        public Builder tooltip(String v) { this.tooltip = v; return this; }
        public Builder clamp(Double min, Double max) { this.clampMin = min; this.clampMax = max; return this; }
        public Builder ui(Double min, Double max) { this.uiMin = min; this.uiMax = max; return this; }
        public Builder elementType(FieldDescriptor d) { this.elementType = d; return this; }
        public Builder keyType(FieldDescriptor d) { this.keyType = d; return this; }
        public Builder valueType(FieldDescriptor d) { this.valueType = d; return this; }

        public FieldDescriptor build() {
            return new FieldDescriptor(this);
        }
    }
}

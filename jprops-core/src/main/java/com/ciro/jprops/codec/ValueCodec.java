package com.ciro.jprops.codec;

import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.resolve.Location;
import com.ciro.jprops.resolve.ResolvedTarget;
import com.ciro.jprops.resolve.SiblingOrderStrategy;
import com.ciro.jprops.spi.AttachmentFamilyProvider;
import com.ciro.jprops.spi.EntityModel;
import com.ciro.jprops.spi.TypeReflection;
import com.ciro.jprops.spi.VirtualProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;

import static com.ciro.jprops.PropertyException.notFound;
import static com.ciro.jprops.PropertyException.typeMismatch;
import static com.ciro.jprops.PropertyException.unsupported;

/**
 * Lectura y escritura sobre un {@link ResolvedTarget} ya resuelto: campos, propiedades
 * virtuales del slot y el orden entre hermanos. La conversión de valores la hace
 * {@link ValueConverter}.
 */
public class ValueCodec {

    private static final Logger log = LoggerFactory.getLogger(ValueCodec.class);

    private final ValueConverter converter;
    private final TypeReflection types;
    private final EntityModel entities;
    private final AttachmentFamilyProvider families;

    public ValueCodec(ValueConverter converter, TypeReflection types,
                      EntityModel entities, AttachmentFamilyProvider families) {
        this.converter = converter;
        this.types = types;
        this.entities = entities;
        this.families = families;
    }

    public ValueConverter converter() {
        return converter;
    }

    /** Descriptor efectivo del destino, también para virtuales y ChildOrder */
    public FieldDescriptor descriptorOf(ResolvedTarget t) {
        if (t.isField()) return t.descriptor();
        if (t.isVirtual()) {
            VirtualProperty vp = t.virtualProperty();
            return types.describe(vp.name(), vp.valueType());
        }
        return types.describe(SiblingOrderStrategy.NAME, int.class);
    }

    public ExternalValue read(ResolvedTarget t) {
        if (t.isSynthetic()) {
            return ExternalValue.ofNode(IntNode.valueOf(requireSiblingIndex(t)));
        }
        if (t.isVirtual()) {
            Object v = families.read(t.root(), t.virtualProperty());
            return ExternalValue.ofNode(converter.toNode(descriptorOf(t), v));
        }
        return ExternalValue.ofNode(converter.toNode(t.descriptor(), t.location().get()));
    }

    public void write(ResolvedTarget t, ExternalValue value) {
        Object prepared = prepare(t, value);

        if (t.isSynthetic()) {
            log.debug("Moving {} to sibling index {}", t.entity(), prepared);
            entities.moveToIndex(t.entity(), (Integer) prepared);
        } else if (t.isVirtual()) {
            families.write(t.root(), t.virtualProperty(), prepared);
        } else {
            assign(t.descriptor(), t.location(), prepared);
        }
    }

    /** Resuelve y convierte sin asignar */
    public void validate(ResolvedTarget t, ExternalValue value) {
        prepare(t, value);
    }

    private Object prepare(ResolvedTarget t, ExternalValue value) {
        if (t.isSynthetic()) {
            int count = entities.siblingCount(t.entity());
            requireSiblingIndex(t);
            int wanted = parseOrdinal(value);
            // fuera de rango se acota, no es error
            return Math.max(0, Math.min(wanted, count - 1));
        }
        if (t.isVirtual()) {
            Object current = families.read(t.root(), t.virtualProperty());
            return converter.convert(descriptorOf(t), value, current);
        }
        FieldDescriptor d = t.descriptor();
        if (!d.editable()) {
            throw unsupported("Property '%s' is read-only", t.path());
        }
        return converter.convert(d, value, t.location().get());
    }

    @SuppressWarnings("unchecked")
    private void assign(FieldDescriptor d, Location loc, Object value) {
        Object current = loc.get();
        // las colecciones se rellenan en sitio para no romper la identidad que tenga el dueño
        try {
            if (current instanceof Collection<?> c && value instanceof Collection<?> n && d.category().isCollection()) {
                Collection<Object> target = (Collection<Object>) c;
                target.clear();
                target.addAll(n);
                return;
            }
            if (current instanceof Map<?, ?> m && value instanceof Map<?, ?> n) {
                Map<Object, Object> target = (Map<Object, Object>) m;
                target.clear();
                target.putAll(n);
                return;
            }
        } catch (UnsupportedOperationException e) {
            log.debug("'{}' is immutable, replacing it", d.name());
        }
        loc.set(value);
    }

    private int requireSiblingIndex(ResolvedTarget t) {
        int idx = entities.siblingIndex(t.entity());
        if (idx < 0) {
            throw notFound("'%s' is not inside a panel: %s is undefined", t.entity(), SiblingOrderStrategy.NAME);
        }
        return idx;
    }

    private static int parseOrdinal(ExternalValue value) {
        if (value.isString()) {
            try {
                return Integer.parseInt(value.text().trim());
            } catch (NumberFormatException e) {
                throw typeMismatch("%s expects an integer, got '%s'", SiblingOrderStrategy.NAME, value.text());
            }
        }
        if (value.isNode()) {
            JsonNode n = value.node();
            if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
            if (n.isTextual()) return parseOrdinal(ExternalValue.ofString(n.asText()));
        }
        throw typeMismatch("%s expects an integer, got %s", SiblingOrderStrategy.NAME, value);
    }
}

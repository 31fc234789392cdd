package com.ciro.jprops.edit;

import com.ciro.jprops.codec.ExternalValue;
import com.ciro.jprops.codec.ValueConverter;
import com.ciro.jprops.reflect.FieldCategory;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.resolve.Location;
import com.ciro.jprops.resolve.ResolvedTarget;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static com.ciro.jprops.PropertyException.outOfRange;
import static com.ciro.jprops.PropertyException.typeMismatch;
import static com.ciro.jprops.PropertyException.unsupported;

/**
 * Ediciones estructurales sobre una propiedad lista.
 * Todos los elementos se convierten antes de tocar la lista: o se aplica entera o no se aplica.
 */
public class CollectionEditor {

    private static final Logger log = LoggerFactory.getLogger(CollectionEditor.class);

    private final ValueConverter converter;

    public CollectionEditor(ValueConverter converter) {
        this.converter = converter;
    }

    @SuppressWarnings("unchecked")
    public void apply(ResolvedTarget target, CollectionOperation op) {
        if (!target.isField() || target.descriptor().category() != FieldCategory.LIST) {
            throw unsupported("Collection operations need a list property; '%s' is not one", target.path());
        }
        FieldDescriptor d = target.descriptor();
        if (!d.editable()) {
            throw unsupported("Property '%s' is read-only", target.path());
        }

        Location loc = target.location();
        List<Object> current = (List<Object>) loc.get();
        boolean fresh = current == null;
        List<Object> list = fresh ? new ArrayList<>() : current;
        FieldDescriptor el = d.elementType();

        log.debug("{} on '{}' (length {})", op.kind(), target.path(), list.size());

        switch (op.kind()) {
            case CLEAR -> mutate(loc, list, fresh, List::clear);
            case SET -> {
                List<Object> items = convertAll(el, op);
                mutate(loc, list, fresh, l -> {
                    l.clear();
                    l.addAll(items);
                });
            }
            case APPEND -> {
                List<Object> items = convertAll(el, op);
                mutate(loc, list, fresh, l -> l.addAll(items));
            }
            case INSERT -> {
                int at = Math.max(0, Math.min(requireIndex(op), list.size()));
                Object item = converter.convert(el, op.payload(), null);
                mutate(loc, list, fresh, l -> l.add(at, item));
            }
            case UPDATE_AT -> {
                int at = checkBounds(op, list);
                Object item = converter.convert(el, op.payload(), list.get(at));
                mutate(loc, list, fresh, l -> l.set(at, item));
            }
            case REMOVE_AT -> {
                int at = checkBounds(op, list);
                mutate(loc, list, fresh, l -> l.remove(at));
            }
        }
    }

    private List<Object> convertAll(FieldDescriptor el, CollectionOperation op) {
        ExternalValue payload = op.payload();
        JsonNode items = payload.isNode() ? payload.node()
                : payload.isString() ? converter.parseJson(payload.text())
                : null;
        if (items == null || !items.isArray()) {
            throw typeMismatch("'%s' requires a JSON array of items, got %s", op.kind(), payload);
        }
        List<Object> out = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            out.add(converter.fromNode(el, item, null));
        }
        return out;
    }

    private static int requireIndex(CollectionOperation op) {
        if (op.index() == null) {
            throw typeMismatch("'%s' requires an index", op.kind());
        }
        return op.index();
    }

    private static int checkBounds(CollectionOperation op, List<Object> list) {
        int i = requireIndex(op);
        if (i < 0 || i >= list.size()) {
            throw outOfRange("Index %d out of bounds for length %d", i, list.size());
        }
        return i;
    }

    // Listas inmutables (List.of, vistas) se sustituyen por una copia editada
    private static void mutate(Location loc, List<Object> list, boolean fresh, Consumer<List<Object>> op) {
        if (fresh) {
            op.accept(list);
            loc.set(list);
            return;
        }
        try {
            op.accept(list);
        } catch (UnsupportedOperationException e) {
            List<Object> copy = new ArrayList<>(list);
            op.accept(copy);
            loc.set(copy);
        }
    }
}

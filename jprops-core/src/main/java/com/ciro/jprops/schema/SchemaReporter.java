package com.ciro.jprops.schema;

import com.ciro.jprops.reflect.EnumNames;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.resolve.ResolvedTarget;
import com.ciro.jprops.spi.AttachmentFamilyProvider;
import com.ciro.jprops.spi.EntityModel;
import com.ciro.jprops.spi.TypeReflection;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class SchemaReporter {

    private final TypeReflection types;
    private final EntityModel entities;
    private final AttachmentFamilyProvider families;

    public SchemaReporter(TypeReflection types, EntityModel entities, AttachmentFamilyProvider families) {
        this.types = types;
        this.entities = entities;
        this.families = families;
    }

    public SchemaReport describe(ResolvedTarget t) {
        if (t.isSynthetic()) {
            int count = entities.siblingCount(t.entity());
            Constraints c = new Constraints(null, 0d, (double) Math.max(0, count - 1), null, null, count);
            return new SchemaReport("int", true, c, null);
        }
        if (t.isVirtual()) {
            FieldDescriptor d = types.describe(t.virtualProperty().name(), t.virtualProperty().valueType());
            Object current = families.read(t.root(), t.virtualProperty());
            return report(d, true, current);
        }
        FieldDescriptor d = t.descriptor();
        return report(d, d.editable(), t.location().get());
    }

    public SchemaReport report(FieldDescriptor d, boolean editable, Object current) {
        Constraints c = switch (d.category()) {
            case ENUM, BYTE_ENUM -> new Constraints(EnumNames.names(d.enumType()), null, null, null, null, null);
            case INT, FLOAT, BYTE -> new Constraints(null, d.clampMin(), d.clampMax(), d.uiMin(), d.uiMax(), null);
            case LIST, SET -> Constraints.NONE.withLength(current instanceof Collection<?> col ? col.size() : 0);
            case MAP -> Constraints.NONE.withLength(current instanceof Map<?, ?> m ? m.size() : 0);
            default -> Constraints.NONE;
        };
        return new SchemaReport(TypeLabels.of(d), editable, c.isEmpty() ? null : c, nestedHint(d));
    }

    private static Map<String, String> nestedHint(FieldDescriptor d) {
        Map<String, String> hint = new LinkedHashMap<>();
        switch (d.category()) {
            case RECORD -> hint.put("recordType", TypeLabels.structName(d.rawType()));
            case LIST, SET -> hint.put("elementType", TypeLabels.of(d.elementType()));
            case MAP -> {
                hint.put("keyType", TypeLabels.of(d.keyType()));
                hint.put("valueType", TypeLabels.of(d.valueType()));
            }
            default -> { }
        }
        return hint.isEmpty() ? null : hint;
    }
}

package com.ciro.jprops.codec;

import com.ciro.jprops.ErrorKind;
import com.ciro.jprops.JsonMappers;
import com.ciro.jprops.PropertyException;
import com.ciro.jprops.reflect.EnumNames;
import com.ciro.jprops.reflect.FieldCategory;
import com.ciro.jprops.reflect.FieldDescriptor;
import com.ciro.jprops.reflect.MapKeys;
import com.ciro.jprops.reflect.StructFactory;
import com.ciro.jprops.resolve.FieldLocation;
import com.ciro.jprops.spi.AssetLoader;
import com.ciro.jprops.spi.TypeReflection;
import com.ciro.jprops.types.LocalizedText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.ciro.jprops.PropertyException.typeMismatch;
import static com.ciro.jprops.PropertyException.unsupported;

/**
 * Conversión por descriptor entre valores externos (texto o JSON) y valores Java.
 * Trabaja a nivel de elemento: no sabe nada de rutas ni de dónde se guarda el resultado.
 * Nunca modifica {@code current}; los structs se construyen sobre una copia.
 */
public class ValueConverter {

    private static final Logger log = LoggerFactory.getLogger(ValueConverter.class);

    private final TypeReflection types;
    private final RichRecordRules rules;
    private final AssetLoader assets;
    private final StructFactory structs;
    private final boolean strictRecordKeys;
    private final ObjectMapper mapper = JsonMappers.create();
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ValueConverter(TypeReflection types, RichRecordRules rules, AssetLoader assets, boolean strictRecordKeys) {
        this.types = types;
        this.rules = rules;
        this.assets = assets;
        this.structs = new StructFactory(types);
        this.strictRecordKeys = strictRecordKeys;
    }

    // =====================================================================
    // Escritura: externo → Java
    // =====================================================================

    public Object convert(FieldDescriptor d, ExternalValue value, Object current) {
        if (value.isAbsent()) {
            throw typeMismatch("A value is required for '%s'", d.name());
        }
        return value.isString()
                ? fromString(d, value.text(), current)
                : fromNode(d, value.node(), current);
    }

    public Object fromString(FieldDescriptor d, String text, Object current) {
        return switch (d.category()) {
            case BOOL -> parseBool(d, text);
            case INT -> {
                try {
                    yield integral(d, Long.parseLong(text.trim()));
                } catch (NumberFormatException e) {
                    throw typeMismatch("'%s' expects an integer, got '%s'", d.name(), text);
                }
            }
            case FLOAT -> {
                try {
                    yield floating(d, Double.parseDouble(text.trim()));
                } catch (NumberFormatException e) {
                    throw typeMismatch("'%s' expects a number, got '%s'", d.name(), text);
                }
            }
            case BYTE -> {
                try {
                    yield toByte(d, Long.parseLong(text.trim()));
                } catch (NumberFormatException e) {
                    throw typeMismatch("'%s' expects a byte (0-255), got '%s'", d.name(), text);
                }
            }
            case STRING -> text;
            case TEXT -> current instanceof LocalizedText t
                    ? new LocalizedText(t.namespace(), t.key(), text)
                    : LocalizedText.of(text);
            case ENUM -> enumValue(d, text);
            case BYTE_ENUM -> (byte) ((Enum<?>) enumValue(d, text)).ordinal();
            case OBJECT -> throw objectWrite(d);
            case RECORD -> recordFromString(d, text, current);
            case LIST, SET, MAP -> {
                JsonNode parsed = parseJson(text);
                if (parsed == null || parsed.isTextual()) {
                    throw typeMismatch("'%s' expects a JSON %s, got '%s'", d.name(),
                            d.category() == FieldCategory.MAP ? "object" : "array", text);
                }
                yield fromNode(d, parsed, current);
            }
            case UNSUPPORTED -> throw unsupportedType(d);
        };
    }

    public Object fromNode(FieldDescriptor d, JsonNode node, Object current) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw typeMismatch("'%s' does not accept null", d.name());
        }
        if (node.isTextual() && d.category() != FieldCategory.STRING) {
            return fromString(d, node.asText(), current);
        }
        return switch (d.category()) {
            case BOOL -> {
                if (node.isBoolean()) yield node.booleanValue();
                if (node.isIntegralNumber()) yield parseBool(d, node.asText());
                throw typeMismatch("'%s' expects a boolean, got %s", d.name(), node);
            }
            case INT -> {
                if (node.isIntegralNumber() && node.canConvertToLong()) yield integral(d, node.longValue());
                if (node.isNumber() && node.doubleValue() == Math.rint(node.doubleValue())) {
                    yield integral(d, (long) node.doubleValue());
                }
                throw typeMismatch("'%s' expects an integer, got %s", d.name(), node);
            }
            case FLOAT -> {
                if (node.isNumber()) yield floating(d, node.doubleValue());
                throw typeMismatch("'%s' expects a number, got %s", d.name(), node);
            }
            case BYTE -> {
                if (node.isIntegralNumber()) yield toByte(d, node.longValue());
                throw typeMismatch("'%s' expects a byte (0-255), got %s", d.name(), node);
            }
            case STRING -> {
                if (node.isValueNode()) yield node.asText();
                throw typeMismatch("'%s' expects a string, got %s", d.name(), node.getNodeType());
            }
            case TEXT, ENUM -> throw typeMismatch("'%s' expects a string, got %s", d.name(), node);
            case BYTE_ENUM -> {
                if (node.isIntegralNumber()) {
                    int ordinal = node.intValue();
                    if (ordinal >= 0 && ordinal < d.enumType().getEnumConstants().length) yield (byte) ordinal;
                }
                throw typeMismatch("'%s' expects one of %s, got %s", d.name(), EnumNames.names(d.enumType()), node);
            }
            case OBJECT -> throw objectWrite(d);
            case RECORD -> recordFromNode(d, node, current);
            case LIST -> {
                List<Object> out = new ArrayList<>();
                for (JsonNode el : requireArray(d, node)) out.add(fromNode(d.elementType(), el, null));
                yield out;
            }
            case SET -> {
                LinkedHashSet<Object> out = new LinkedHashSet<>();
                for (JsonNode el : requireArray(d, node)) out.add(fromNode(d.elementType(), el, null));
                yield out;
            }
            case MAP -> {
                if (!node.isObject()) {
                    throw typeMismatch("'%s' expects a JSON object keyed by %s", d.name(),
                            d.keyType().rawType().getSimpleName());
                }
                Map<Object, Object> out = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    out.put(MapKeys.fromText(d.keyType(), e.getKey()), fromNode(d.valueType(), e.getValue(), null));
                }
                yield out;
            }
            case UNSUPPORTED -> throw unsupportedType(d);
        };
    }

    // ---- structs --------------------------------------------------------

    private Object recordFromString(FieldDescriptor d, String text, Object current) {
        RichRecordRule rule = rules.find(d.rawType());
        PropertyException richFailure = null;
        if (rule != null) {
            try {
                return rule.fromString(text, current);
            } catch (PropertyException e) {
                if (e.kind() != ErrorKind.TYPE_MISMATCH) throw e;
                richFailure = e;
            }
        }
        JsonNode parsed = parseJson(text);
        if (parsed == null || parsed.isTextual()) {
            if (richFailure != null) throw richFailure;
            throw typeMismatch("'%s' is not valid JSON for struct %s", text, d.rawType().getSimpleName());
        }
        return recordFromNode(d, parsed, current);
    }

    private Object recordFromNode(FieldDescriptor d, JsonNode node, Object current) {
        RichRecordRule rule = rules.find(d.rawType());
        PropertyException richFailure = null;
        if (rule != null) {
            try {
                return rule.fromNode(node, current);
            } catch (PropertyException e) {
                if (e.kind() != ErrorKind.TYPE_MISMATCH) throw e;
                richFailure = e;
            }
        }
        try {
            return genericRecord(d, node, current);
        } catch (PropertyException e) {
            // la regla específica explica mejor qué formas acepta
            if (richFailure != null) throw richFailure;
            throw e;
        }
    }

    private record Pending(FieldDescriptor field, Object value) {}

    private Object genericRecord(FieldDescriptor d, JsonNode node, Object current) {
        Class<?> type = d.rawType();
        if (!node.isObject()) {
            throw typeMismatch("Struct %s expects a JSON object of its fields, got %s",
                    type.getSimpleName(), node.getNodeType());
        }
        Object target = current != null ? structs.copy(type, current) : structs.create(type);

        // primero se convierte todo; solo después se asigna
        List<Pending> pending = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Optional<FieldDescriptor> sub = types.findField(type, e.getKey(), true);
            if (sub.isEmpty()) {
                if (strictRecordKeys) {
                    throw typeMismatch("Unknown field '%s' for struct %s", e.getKey(), type.getSimpleName());
                }
                log.debug("Ignoring unknown key '{}' for struct {}", e.getKey(), type.getSimpleName());
                continue;
            }
            FieldDescriptor f = sub.get();
            if (!f.editable()) {
                throw unsupported("Field '%s' of struct %s is read-only", f.name(), type.getSimpleName());
            }
            FieldLocation loc = new FieldLocation(target, f.field());
            pending.add(new Pending(f, fromNode(f, e.getValue(), loc.get())));
        }
        for (Pending p : pending) {
            new FieldLocation(target, p.field().field()).set(p.value());
        }
        return target;
    }

    // ---- escalares ------------------------------------------------------

    private Object parseBool(FieldDescriptor d, String text) {
        String s = text.trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "1" -> Boolean.TRUE;
            case "false", "0" -> Boolean.FALSE;
            default -> throw typeMismatch("'%s' expects true/false/1/0, got '%s'", d.name(), text);
        };
    }

    private Object integral(FieldDescriptor d, long v) {
        Class<?> raw = d.rawType();
        if (raw == long.class || raw == Long.class) return clampIntegral(d, v);
        if (raw == short.class || raw == Short.class) {
            if (v < Short.MIN_VALUE || v > Short.MAX_VALUE) throw outOfType(d, v);
            return (short) clampIntegral(d, v);
        }
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) throw outOfType(d, v);
        return (int) clampIntegral(d, v);
    }

    private Object floating(FieldDescriptor d, double v) {
        Class<?> raw = d.rawType();
        boolean wide = raw == double.class || raw == Double.class;
        if (!Double.isFinite(v) || (!wide && !Float.isFinite((float) v))) {
            throw typeMismatch("'%s' expects a finite number, got %s", d.name(), v);
        }
        double clamped = clamp(d, v);
        return wide ? (Object) clamped : (Object) (float) clamped;
    }

    private Object toByte(FieldDescriptor d, long v) {
        if (v < 0 || v > 255) throw outOfType(d, v);
        return (byte) clampIntegral(d, v);
    }

    /** Aplica clampMin/clampMax declarados; sin límites el valor pasa igual */
    private static double clamp(FieldDescriptor d, double v) {
        double out = v;
        if (d.clampMin() != null && out < d.clampMin()) out = d.clampMin();
        if (d.clampMax() != null && out > d.clampMax()) out = d.clampMax();
        if (out != v) log.debug("'{}' clamped from {} to {}", d.name(), v, out);
        return out;
    }

    private static long clampIntegral(FieldDescriptor d, long v) {
        long out = v;
        if (d.clampMin() != null && out < d.clampMin()) out = (long) Math.ceil(d.clampMin());
        if (d.clampMax() != null && out > d.clampMax()) out = (long) Math.floor(d.clampMax());
        if (out != v) log.debug("'{}' clamped from {} to {}", d.name(), v, out);
        return out;
    }

    private Object enumValue(FieldDescriptor d, String text) {
        return EnumNames.lenient(d.enumType(), text.trim())
                .orElseThrow(() -> typeMismatch("'%s' is not a valid %s; expected one of %s",
                        text, d.enumType().getSimpleName(), EnumNames.names(d.enumType())));
    }

    private static Iterable<JsonNode> requireArray(FieldDescriptor d, JsonNode node) {
        if (!node.isArray()) {
            throw typeMismatch("'%s' expects a JSON array, got %s", d.name(), node.getNodeType());
        }
        return node;
    }

    /** null si el texto no es JSON */
    public JsonNode parseJson(String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            log.debug("Value '{}' is not JSON: {}", text, e.getOriginalMessage());
            return null;
        }
    }

    private static PropertyException outOfType(FieldDescriptor d, long v) {
        return typeMismatch("Value %d does not fit in '%s' (%s)", v, d.name(), d.rawType().getSimpleName());
    }

    private static PropertyException objectWrite(FieldDescriptor d) {
        return unsupported("'%s' is an object reference (%s) and cannot be assigned from a value",
                d.name(), d.rawType().getSimpleName());
    }

    private static PropertyException unsupportedType(FieldDescriptor d) {
        return unsupported("Type %s of '%s' is not supported", d.genericType().getTypeName(), d.name());
    }

    // =====================================================================
    // Lectura: Java → JSON
    // =====================================================================

    public JsonNode toNode(FieldDescriptor d, Object value) {
        if (value == null) return NullNode.getInstance();

        return switch (d.category()) {
            case BOOL -> nodes.booleanNode((Boolean) value);
            case INT -> value instanceof Long l ? nodes.numberNode(l) : nodes.numberNode(((Number) value).intValue());
            case FLOAT -> value instanceof Double v ? nodes.numberNode(v) : nodes.numberNode(((Number) value).floatValue());
            case BYTE -> nodes.numberNode(Byte.toUnsignedInt((Byte) value));
            case STRING -> nodes.textNode((String) value);
            case TEXT -> nodes.textNode(((LocalizedText) value).source());
            case ENUM -> nodes.textNode(((Enum<?>) value).name());
            case BYTE_ENUM -> {
                int ordinal = Byte.toUnsignedInt((Byte) value);
                Enum<?>[] constants = d.enumType().getEnumConstants();
                yield ordinal < constants.length ? nodes.textNode(constants[ordinal].name()) : nodes.numberNode(ordinal);
            }
            case OBJECT -> objectMarker(value);
            case RECORD -> {
                RichRecordRule rule = rules.find(d.rawType());
                JsonNode rich = rule == null ? null : rule.toNode(value);
                yield rich != null ? rich : genericRecordNode(d.rawType(), value);
            }
            case LIST, SET -> {
                ArrayNode arr = nodes.arrayNode();
                for (Object el : (Collection<?>) value) arr.add(toNode(d.elementType(), el));
                yield arr;
            }
            case MAP -> {
                ObjectNode obj = nodes.objectNode();
                for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                    obj.set(MapKeys.toText(e.getKey()), toNode(d.valueType(), e.getValue()));
                }
                yield obj;
            }
            case UNSUPPORTED -> throw unsupportedType(d);
        };
    }

    private JsonNode genericRecordNode(Class<?> type, Object value) {
        ObjectNode obj = nodes.objectNode();
        for (FieldDescriptor f : types.fields(type)) {
            obj.set(f.name(), toNode(f, new FieldLocation(value, f.field()).get()));
        }
        return obj;
    }

    /** Las referencias se leen como {"ref": clase, "path": ruta del recurso si se conoce} */
    public ObjectNode objectMarker(Object value) {
        ObjectNode marker = nodes.objectNode();
        marker.put("ref", value.getClass().getSimpleName());
        assets.pathOf(value).ifPresent(p -> marker.put("path", p));
        return marker;
    }
}

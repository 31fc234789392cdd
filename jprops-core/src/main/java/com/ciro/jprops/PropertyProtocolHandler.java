package com.ciro.jprops;

import com.ciro.jprops.codec.ExternalValue;
import com.ciro.jprops.edit.CollectionOpKind;
import com.ciro.jprops.edit.CollectionOperation;
import com.ciro.jprops.schema.SchemaReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Protocolo JSON sobre {@link PropertyEngine} (agnóstico del transporte).
 * <pre>
 * → {"action":"set","path":"Slot.Padding","value":[4,4,4,4]}
 * ← {"ok":true,"path":"Slot.Padding"}
 * ← {"ok":false,"error":{"kind":"NOT_FOUND","message":"..."}}
 * </pre>
 * Un {@code value} string se trata como texto plano ("#FF0000", "Visible");
 * cualquier otro nodo se pasa como JSON.
 */
public class PropertyProtocolHandler {

    private static final Logger log = LoggerFactory.getLogger(PropertyProtocolHandler.class);

    private final PropertyEngine engine;
    private final ObjectMapper mapper;

    public PropertyProtocolHandler(PropertyEngine engine, ObjectMapper mapper) {
        this.engine = engine;
        this.mapper = mapper;
    }

    public PropertyProtocolHandler(PropertyEngine engine) {
        this(engine, JsonMappers.create());
    }

    /** Entrada de texto: la petición cruda tal como llega del socket */
    public String handleText(Object entity, String payload) {
        try {
            JsonNode request = mapper.readTree(payload);
            return mapper.writeValueAsString(handle(entity, request));
        } catch (JsonProcessingException e) {
            log.warn("Malformed request: {}", e.getOriginalMessage());
            return error(ErrorKind.TYPE_MISMATCH, "Malformed JSON request: " + e.getOriginalMessage()).toString();
        }
    }

    public ObjectNode handle(Object entity, JsonNode request) {
        if (request == null || !request.isObject()) {
            return error(ErrorKind.TYPE_MISMATCH, "Request must be a JSON object");
        }
        String action = request.path("action").asText("");
        String path = request.path("path").asText(null);

        return switch (action) {
            case "get" -> requirePath(path, () -> toResponse(engine.get(entity, path), this::valueBody));
            case "set" -> requirePath(path, () ->
                    toResponse(engine.set(entity, path, externalValue(request.get("value"))), v -> pathBody(path)));
            case "describe" -> requirePath(path, () -> toResponse(engine.describe(entity, path), this::schemaBody));
            case "validate" -> requirePath(path, () ->
                    toResponse(engine.validate(entity, path, externalValue(request.get("value"))), v -> pathBody(path)));
            case "collection" -> requirePath(path, () -> collection(entity, path, request));
            case "list" -> toResponse(
                    engine.listProperties(entity, request.path("includeSlot").asBoolean(true)),
                    props -> {
                        ObjectNode body = ok();
                        body.set("properties", mapper.valueToTree(props));
                        return body;
                    });
            case "batch" -> batch(entity, request.get("updates"));
            default -> error(ErrorKind.UNSUPPORTED, "Unknown action '" + action
                    + "'; expected get, set, describe, validate, collection, list or batch");
        };
    }

    // ---------------------------------------------------------------------

    private ObjectNode collection(Object entity, String path, JsonNode request) {
        CollectionOpKind kind;
        try {
            kind = CollectionOpKind.parse(request.path("operation").asText(""));
        } catch (IllegalArgumentException e) {
            return error(ErrorKind.UNSUPPORTED, e.getMessage());
        }
        JsonNode idx = request.get("index");
        Integer index = idx != null && idx.canConvertToInt() && idx.isIntegralNumber() ? idx.intValue() : null;
        CollectionOperation op = new CollectionOperation(kind, index, externalValue(request.get("value")));
        return toResponse(engine.apply(entity, path, op), v -> pathBody(path));
    }

    private ObjectNode batch(Object entity, JsonNode updates) {
        if (updates == null || !updates.isArray()) {
            return error(ErrorKind.TYPE_MISMATCH, "'updates' must be an array of {path, value}");
        }
        List<PropertyUpdate> list = new ArrayList<>();
        for (JsonNode u : updates) {
            list.add(new PropertyUpdate(u.path("path").asText(""), externalValue(u.get("value"))));
        }
        return toResponse(engine.setBatch(entity, list), errors -> {
            ObjectNode body = ok();
            body.put("applied", list.size() - errors.size());
            ArrayNode arr = body.putArray("errors");
            errors.forEach(arr::add);
            return body;
        });
    }

    private static ExternalValue externalValue(JsonNode value) {
        if (value != null && value.isTextual()) return ExternalValue.ofString(value.asText());
        return ExternalValue.ofNode(value);
    }

    private ObjectNode valueBody(PropertyValue v) {
        ObjectNode body = ok();
        body.setAll((ObjectNode) mapper.valueToTree(v));
        if (!body.has("value")) body.putNull("value");
        return body;
    }

    private ObjectNode schemaBody(SchemaReport r) {
        ObjectNode body = ok();
        body.setAll((ObjectNode) mapper.valueToTree(r));
        return body;
    }

    private ObjectNode pathBody(String path) {
        ObjectNode body = ok();
        body.put("path", path);
        return body;
    }

    private ObjectNode requirePath(String path, Supplier<ObjectNode> body) {
        if (path == null || path.isBlank()) {
            return error(ErrorKind.INVALID_PATH, "'path' is required");
        }
        return body.get();
    }

    private <T> ObjectNode toResponse(PropertyResult<T> r, Function<T, ObjectNode> onSuccess) {
        if (r.isSuccess()) return onSuccess.apply(r.value());
        return error(r.error().kind(), r.error().message());
    }

    private ObjectNode ok() {
        ObjectNode n = mapper.createObjectNode();
        n.put("ok", true);
        return n;
    }

    private ObjectNode error(ErrorKind kind, String message) {
        ObjectNode n = mapper.createObjectNode();
        n.put("ok", false);
        ObjectNode err = n.putObject("error");
        err.put("kind", kind.name());
        err.put("message", message);
        return n;
    }
}

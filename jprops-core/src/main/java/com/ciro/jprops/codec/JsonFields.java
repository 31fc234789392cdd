package com.ciro.jprops.codec;

import com.ciro.jprops.PropertyException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/** Acceso a objetos JSON sin distinguir mayúsculas en las claves ("tintColor" = "TintColor"). */
final class JsonFields {

    private JsonFields() {}

    static JsonNode get(JsonNode object, String name) {
        if (object == null || !object.isObject()) return null;
        JsonNode exact = object.get(name);
        if (exact != null) return exact;
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    static float number(JsonNode n, String what) {
        if (n == null || !n.isNumber()) {
            throw PropertyException.typeMismatch("%s must be a number, got %s",
                    what, n == null ? "nothing" : n.getNodeType());
        }
        return n.floatValue();
    }
}

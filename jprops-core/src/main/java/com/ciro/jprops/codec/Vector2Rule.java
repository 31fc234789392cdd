package com.ciro.jprops.codec;

import com.ciro.jprops.types.Vector2;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import static com.ciro.jprops.PropertyException.typeMismatch;

/** Vector2: {@code [x,y]} o {@code {X,Y}}; se lee como {@code [x,y]}. */
public class Vector2Rule implements RichRecordRule {

    @Override
    public Class<?> type() {
        return Vector2.class;
    }

    @Override
    public Object fromNode(JsonNode node, Object current) {
        if (node.isArray()) {
            if (node.size() != 2) {
                throw typeMismatch("Vector2 array needs exactly 2 numbers [x,y], got %d", node.size());
            }
            return new Vector2(JsonFields.number(node.get(0), "X"), JsonFields.number(node.get(1), "Y"));
        }
        if (node.isObject()) {
            JsonNode x = JsonFields.get(node, "X");
            JsonNode y = JsonFields.get(node, "Y");
            if (x == null && y == null) {
                throw typeMismatch("Vector2 object needs X and/or Y");
            }
            Vector2 base = current instanceof Vector2 v ? v.copy() : new Vector2();
            if (x != null) base.setX(JsonFields.number(x, "X"));
            if (y != null) base.setY(JsonFields.number(y, "Y"));
            return base;
        }
        throw typeMismatch("Unsupported Vector2 value %s; expected [x,y] or {X,Y}", node);
    }

    @Override
    public JsonNode toNode(Object value) {
        Vector2 v = (Vector2) value;
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        arr.add(v.getX()).add(v.getY());
        return arr;
    }
}

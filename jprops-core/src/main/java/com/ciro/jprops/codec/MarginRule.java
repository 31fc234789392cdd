package com.ciro.jprops.codec;

import com.ciro.jprops.types.Margin;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import static com.ciro.jprops.PropertyException.typeMismatch;

/**
 * Margin: {@code [todos]}, {@code [horizontal,vertical]}, {@code [left,top,right,bottom]}
 * o {@code {Left,Top,Right,Bottom}}.
 * En la forma objeto los bordes ausentes conservan el valor actual.
 */
public class MarginRule implements RichRecordRule {

    private static final String[] EDGES = {"Left", "Top", "Right", "Bottom"};

    @Override
    public Class<?> type() {
        return Margin.class;
    }

    @Override
    public Object fromNode(JsonNode node, Object current) {
        if (node.isArray()) {
            switch (node.size()) {
                case 1 -> {
                    float all = JsonFields.number(node.get(0), "Uniform");
                    return new Margin(all, all, all, all);
                }
                case 2 -> {
                    float h = JsonFields.number(node.get(0), "Horizontal");
                    float v = JsonFields.number(node.get(1), "Vertical");
                    return new Margin(h, v, h, v);
                }
                case 4 -> {
                    return new Margin(
                            JsonFields.number(node.get(0), "Left"),
                            JsonFields.number(node.get(1), "Top"),
                            JsonFields.number(node.get(2), "Right"),
                            JsonFields.number(node.get(3), "Bottom"));
                }
                default -> throw typeMismatch(
                        "Margin array needs [all], [horizontal,vertical] or [left,top,right,bottom], got %d numbers",
                        node.size());
            }
        }
        if (node.isObject()) {
            Margin m = current instanceof Margin c ? c.copy() : new Margin();
            int applied = 0;
            for (String edge : EDGES) {
                JsonNode v = JsonFields.get(node, edge);
                if (v == null) continue;
                float f = JsonFields.number(v, edge);
                switch (edge) {
                    case "Left" -> m.setLeft(f);
                    case "Top" -> m.setTop(f);
                    case "Right" -> m.setRight(f);
                    default -> m.setBottom(f);
                }
                applied++;
            }
            if (applied == 0) {
                throw typeMismatch("Margin object needs at least one of Left, Top, Right, Bottom");
            }
            return m;
        }
        throw typeMismatch("Unsupported Margin value %s; expected [a], [h,v], [l,t,r,b] or {Left,Top,Right,Bottom}", node);
    }

    @Override
    public JsonNode toNode(Object value) {
        Margin m = (Margin) value;
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        arr.add(m.getLeft()).add(m.getTop()).add(m.getRight()).add(m.getBottom());
        return arr;
    }
}

package com.ciro.jprops.codec;

import com.ciro.jprops.types.LinearColor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import static com.ciro.jprops.PropertyException.typeMismatch;

/**
 * LinearColor: {@code [r,g,b]}, {@code [r,g,b,a]}, {@code {R,G,B,A}}, {@code "#RRGGBB[AA]"}
 * o un nombre ("red"). Alpha por defecto 1. Se lee siempre como {@code [r,g,b,a]}.
 */
public class ColorRule implements RichRecordRule {

    private static final String FORMS = "expected [r,g,b(,a)], {R,G,B(,A)}, '#RRGGBB(AA)' or a color name";

    @Override
    public Class<?> type() {
        return LinearColor.class;
    }

    @Override
    public Object fromNode(JsonNode node, Object current) {
        if (node.isTextual()) return fromString(node.asText(), current);

        if (node.isArray()) {
            if (node.size() < 3 || node.size() > 4) {
                throw typeMismatch("Color array needs 3 or 4 numbers, got %d; %s", node.size(), FORMS);
            }
            float a = node.size() == 4 ? JsonFields.number(node.get(3), "Color A") : 1f;
            return new LinearColor(
                    JsonFields.number(node.get(0), "Color R"),
                    JsonFields.number(node.get(1), "Color G"),
                    JsonFields.number(node.get(2), "Color B"),
                    a);
        }

        if (node.isObject()) {
            JsonNode r = JsonFields.get(node, "R");
            JsonNode g = JsonFields.get(node, "G");
            JsonNode b = JsonFields.get(node, "B");
            if (r == null || g == null || b == null) {
                throw typeMismatch("Color object needs R, G and B; %s", FORMS);
            }
            JsonNode a = JsonFields.get(node, "A");
            return new LinearColor(
                    JsonFields.number(r, "Color R"),
                    JsonFields.number(g, "Color G"),
                    JsonFields.number(b, "Color B"),
                    a == null ? 1f : JsonFields.number(a, "Color A"));
        }
        throw typeMismatch("Unsupported color value %s; %s", node, FORMS);
    }

    @Override
    public Object fromString(String text, Object current) {
        String s = text.trim();
        if (s.startsWith("#")) return fromHex(s);
        return NamedColors.find(s)
                .orElseThrow(() -> typeMismatch("Unknown color '%s'; %s", text, FORMS));
    }

    @Override
    public JsonNode toNode(Object value) {
        LinearColor c = (LinearColor) value;
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        arr.add(c.getR()).add(c.getG()).add(c.getB()).add(c.getA());
        return arr;
    }

    private static LinearColor fromHex(String s) {
        String hex = s.substring(1);
        if (hex.length() != 6 && hex.length() != 8) {
            throw typeMismatch("Hex color '%s' must be #RRGGBB or #RRGGBBAA", s);
        }
        try {
            float r = Integer.parseInt(hex.substring(0, 2), 16) / 255f;
            float g = Integer.parseInt(hex.substring(2, 4), 16) / 255f;
            float b = Integer.parseInt(hex.substring(4, 6), 16) / 255f;
            float a = hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) / 255f : 1f;
            return new LinearColor(r, g, b, a);
        } catch (NumberFormatException e) {
            throw typeMismatch("Hex color '%s' has invalid digits", s);
        }
    }
}

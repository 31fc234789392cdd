package com.ciro.jprops.codec;

import com.ciro.jprops.PropertyException;
import com.ciro.jprops.types.ButtonStyle;
import com.ciro.jprops.types.SlateBrush;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.ciro.jprops.PropertyException.typeMismatch;

/**
 * ButtonStyle desde {@code {Normal:{TintColor..}, Hovered:{..}, Pressed:{..}}}.
 * Cada estado se aplica sobre su brush con {@link BrushRule}.
 */
public class ButtonStyleRule implements RichRecordRule {

    private static final Logger log = LoggerFactory.getLogger(ButtonStyleRule.class);

    private final BrushRule brushes;

    public ButtonStyleRule(BrushRule brushes) {
        this.brushes = brushes;
    }

    @Override
    public Class<?> type() {
        return ButtonStyle.class;
    }

    @Override
    public Object fromNode(JsonNode node, Object current) {
        if (!node.isObject()) {
            throw typeMismatch("ButtonStyle requires an object with Normal, Hovered or Pressed states");
        }
        ButtonStyle style = current instanceof ButtonStyle s ? s.copy() : new ButtonStyle();
        int modified = 0;

        JsonNode normal = JsonFields.get(node, "Normal");
        if (normal != null) {
            SlateBrush b = applyState("Normal", normal, style.getNormal());
            if (b != null) { style.setNormal(b); modified++; }
        }
        JsonNode hovered = JsonFields.get(node, "Hovered");
        if (hovered != null) {
            SlateBrush b = applyState("Hovered", hovered, style.getHovered());
            if (b != null) { style.setHovered(b); modified++; }
        }
        JsonNode pressed = JsonFields.get(node, "Pressed");
        if (pressed != null) {
            SlateBrush b = applyState("Pressed", pressed, style.getPressed());
            if (b != null) { style.setPressed(b); modified++; }
        }

        if (modified == 0) {
            throw typeMismatch("No ButtonStyle state could be applied; expected Normal, Hovered or Pressed "
                    + "objects carrying a TintColor");
        }
        return style;
    }

    private SlateBrush applyState(String state, JsonNode value, SlateBrush current) {
        try {
            return (SlateBrush) brushes.fromNode(value, current);
        } catch (PropertyException e) {
            log.warn("Skipping ButtonStyle state {}: {}", state, e.getMessage());
            return null;
        }
    }
}

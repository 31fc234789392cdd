package com.ciro.jprops.types;

import com.ciro.jprops.annotations.Struct;

import java.util.Objects;

/** Un brush por estado del botón más el relleno del contenido. */
@Struct("ButtonStyle")
public class ButtonStyle {

    private SlateBrush normal = new SlateBrush();
    private SlateBrush hovered = new SlateBrush();
    private SlateBrush pressed = new SlateBrush();
    private SlateBrush disabled = new SlateBrush();
    private Margin normalPadding = new Margin(12f, 1f, 12f, 1f);

    public ButtonStyle() {}

    public ButtonStyle copy() {
        ButtonStyle c = new ButtonStyle();
        c.normal = normal == null ? null : normal.copy();
        c.hovered = hovered == null ? null : hovered.copy();
        c.pressed = pressed == null ? null : pressed.copy();
        c.disabled = disabled == null ? null : disabled.copy();
        c.normalPadding = normalPadding == null ? null : normalPadding.copy();
        return c;
    }

    public SlateBrush getNormal() { return normal; }
    public void setNormal(SlateBrush normal) { this.normal = normal; }
    public SlateBrush getHovered() { return hovered; }
    public void setHovered(SlateBrush hovered) { this.hovered = hovered; }
    public SlateBrush getPressed() { return pressed; }
    public void setPressed(SlateBrush pressed) { this.pressed = pressed; }
    public SlateBrush getDisabled() { return disabled; }
    public void setDisabled(SlateBrush disabled) { this.disabled = disabled; }
    public Margin getNormalPadding() { return normalPadding; }
    public void setNormalPadding(Margin normalPadding) { this.normalPadding = normalPadding; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ButtonStyle s)) return false;
        return Objects.equals(normal, s.normal) && Objects.equals(hovered, s.hovered)
                && Objects.equals(pressed, s.pressed) && Objects.equals(disabled, s.disabled)
                && Objects.equals(normalPadding, s.normalPadding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normal, hovered, pressed, disabled, normalPadding);
    }
}

package com.ciro.jprops.model;

import com.ciro.jprops.annotations.EnumAsByte;
import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.ButtonStyle;
import com.ciro.jprops.types.LinearColor;

public class Button extends PanelWidget {

    @Property(category = "Appearance")
    private ButtonStyle style = new ButtonStyle();

    @Property(category = "Appearance")
    private LinearColor backgroundColor = LinearColor.white();

    @Property(category = "Interaction")
    @EnumAsByte(ClickMethod.class)
    private byte clickMethod;

    @Property(category = "Interaction")
    private boolean focusable = true;

    public Button(String name) {
        super(name);
    }

    // un botón tiene como mucho un hijo; usa el slot de overlay
    @Override
    protected PanelSlot createSlot() {
        return new OverlaySlot();
    }

    public ButtonStyle getStyle() { return style; }
    public void setStyle(ButtonStyle style) { this.style = style; }
    public LinearColor getBackgroundColor() { return backgroundColor; }
    public void setBackgroundColor(LinearColor c) { this.backgroundColor = c; }
    public ClickMethod getClickMethod() { return ClickMethod.values()[clickMethod]; }
    public void setClickMethod(ClickMethod m) { this.clickMethod = (byte) m.ordinal(); }
    public boolean isFocusable() { return focusable; }
    public void setFocusable(boolean focusable) { this.focusable = focusable; }
}

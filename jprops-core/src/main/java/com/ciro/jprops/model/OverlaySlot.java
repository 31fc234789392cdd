package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.Margin;

public class OverlaySlot extends PanelSlot {

    @Property(category = "Layout")
    private Margin padding = new Margin();

    private HorizontalAlignment horizontalAlignment = HorizontalAlignment.FILL;
    private VerticalAlignment verticalAlignment = VerticalAlignment.FILL;

    public Margin getPadding() { return padding; }
    public void setPadding(Margin padding) { this.padding = padding; }
    public HorizontalAlignment getHorizontalAlignment() { return horizontalAlignment; }
    public void setHorizontalAlignment(HorizontalAlignment h) { this.horizontalAlignment = h; }
    public VerticalAlignment getVerticalAlignment() { return verticalAlignment; }
    public void setVerticalAlignment(VerticalAlignment v) { this.verticalAlignment = v; }
}

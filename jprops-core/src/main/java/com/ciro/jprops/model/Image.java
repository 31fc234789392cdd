package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.LinearColor;
import com.ciro.jprops.types.SlateBrush;

public class Image extends Widget {

    @Property(category = "Appearance")
    private SlateBrush brush = new SlateBrush();

    @Property(category = "Appearance")
    private LinearColor colorAndOpacity = LinearColor.white();

    public Image(String name) {
        super(name);
    }

    public SlateBrush getBrush() { return brush; }
    public void setBrush(SlateBrush brush) { this.brush = brush; }
    public LinearColor getColorAndOpacity() { return colorAndOpacity; }
    public void setColorAndOpacity(LinearColor c) { this.colorAndOpacity = c; }
}

package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.Margin;

/** Slot de caja vertical u horizontal. */
public abstract class BoxSlot extends PanelSlot {

    @Property(category = "Layout")
    private Margin padding = new Margin();

    @Property(category = "Layout")
    private SlotSize size = new SlotSize(1f, SizeRule.AUTOMATIC);

    private HorizontalAlignment horizontalAlignment = HorizontalAlignment.FILL;
    private VerticalAlignment verticalAlignment = VerticalAlignment.FILL;

    public Margin getPadding() { return padding; }
    public void setPadding(Margin padding) { this.padding = padding; }
    public SlotSize getSize() { return size; }
    public void setSize(SlotSize size) { this.size = size; }
    public HorizontalAlignment getHorizontalAlignment() { return horizontalAlignment; }
    public void setHorizontalAlignment(HorizontalAlignment h) { this.horizontalAlignment = h; }
    public VerticalAlignment getVerticalAlignment() { return verticalAlignment; }
    public void setVerticalAlignment(VerticalAlignment v) { this.verticalAlignment = v; }
}

package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.Margin;
import com.ciro.jprops.types.Vector2;

/**
 * Slot de posición libre. Position, Size, Anchors, Alignment, AutoSize y ZOrder se exponen
 * como propiedades virtuales (ver {@link SlotFamilies}); LayoutData es el campo real.
 */
public class CanvasPanelSlot extends PanelSlot {

    @Property(category = "Layout")
    private AnchorData layoutData = new AnchorData();

    private boolean autoSize;
    private int zOrder;

    public AnchorData getLayoutData() { return layoutData; }
    public void setLayoutData(AnchorData layoutData) { this.layoutData = layoutData; }

    public Vector2 getPosition() {
        Margin o = layoutData.getOffsets();
        return new Vector2(o.getLeft(), o.getTop());
    }

    public void setPosition(Vector2 position) {
        Margin o = layoutData.getOffsets().copy();
        o.setLeft(position.getX());
        o.setTop(position.getY());
        layoutData.setOffsets(o);
    }

    public Vector2 getSize() {
        Margin o = layoutData.getOffsets();
        return new Vector2(o.getRight(), o.getBottom());
    }

    public void setSize(Vector2 size) {
        Margin o = layoutData.getOffsets().copy();
        o.setRight(size.getX());
        o.setBottom(size.getY());
        layoutData.setOffsets(o);
    }

    public Anchors getAnchors() { return layoutData.getAnchors(); }
    public void setAnchors(Anchors anchors) { layoutData.setAnchors(anchors); }
    public Vector2 getAlignment() { return layoutData.getAlignment(); }
    public void setAlignment(Vector2 alignment) { layoutData.setAlignment(alignment); }
    public boolean isAutoSize() { return autoSize; }
    public void setAutoSize(boolean autoSize) { this.autoSize = autoSize; }
    public int getZOrder() { return zOrder; }
    public void setZOrder(int zOrder) { this.zOrder = zOrder; }
}

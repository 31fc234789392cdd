package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Struct;
import com.ciro.jprops.types.Margin;
import com.ciro.jprops.types.Vector2;

/**
 * Datos de posición dentro de un canvas. Con anclas en un punto, {@code offsets} guarda
 * posición (left, top) y tamaño (right, bottom).
 */
@Struct("AnchorData")
public class AnchorData {

    private Margin offsets = new Margin(0f, 0f, 100f, 30f);
    private Anchors anchors = new Anchors();
    private Vector2 alignment = new Vector2(0f, 0f);

    public Margin getOffsets() { return offsets; }
    public void setOffsets(Margin offsets) { this.offsets = offsets; }
    public Anchors getAnchors() { return anchors; }
    public void setAnchors(Anchors anchors) { this.anchors = anchors; }
    public Vector2 getAlignment() { return alignment; }
    public void setAlignment(Vector2 alignment) { this.alignment = alignment; }
}

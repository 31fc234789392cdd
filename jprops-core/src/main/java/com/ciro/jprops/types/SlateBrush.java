package com.ciro.jprops.types;

import com.ciro.jprops.annotations.Struct;

import java.util.Objects;

/**
 * Cómo pintar una superficie: recurso (textura, material...), modo de dibujo,
 * repetición y tinte. El recurso es una referencia, no se copia.
 */
@Struct("SlateBrush")
public class SlateBrush {

    private Object resourceObject;
    private BrushDrawType drawAs = BrushDrawType.IMAGE;
    private BrushTiling tiling = BrushTiling.NO_TILE;
    private LinearColor tintColor = LinearColor.white();
    private Vector2 imageSize = new Vector2(32f, 32f);

    public SlateBrush() {}

    public SlateBrush copy() {
        SlateBrush c = new SlateBrush();
        c.resourceObject = resourceObject;
        c.drawAs = drawAs;
        c.tiling = tiling;
        c.tintColor = tintColor == null ? null : tintColor.copy();
        c.imageSize = imageSize == null ? null : imageSize.copy();
        return c;
    }

    public Object getResourceObject() { return resourceObject; }
    public void setResourceObject(Object resourceObject) { this.resourceObject = resourceObject; }
    public BrushDrawType getDrawAs() { return drawAs; }
    public void setDrawAs(BrushDrawType drawAs) { this.drawAs = drawAs; }
    public BrushTiling getTiling() { return tiling; }
    public void setTiling(BrushTiling tiling) { this.tiling = tiling; }
    public LinearColor getTintColor() { return tintColor; }
    public void setTintColor(LinearColor tintColor) { this.tintColor = tintColor; }
    public Vector2 getImageSize() { return imageSize; }
    public void setImageSize(Vector2 imageSize) { this.imageSize = imageSize; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlateBrush s)) return false;
        return resourceObject == s.resourceObject && drawAs == s.drawAs && tiling == s.tiling
                && Objects.equals(tintColor, s.tintColor) && Objects.equals(imageSize, s.imageSize);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(resourceObject), drawAs, tiling, tintColor, imageSize);
    }

    @Override
    public String toString() {
        return "SlateBrush[" + drawAs + "," + tiling + ",tint=" + tintColor + ",res=" + resourceObject + "]";
    }
}

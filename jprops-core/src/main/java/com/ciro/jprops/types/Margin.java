package com.ciro.jprops.types;

import com.ciro.jprops.annotations.Struct;

import java.util.Objects;

/** Márgenes en orden izquierda, arriba, derecha, abajo. */
@Struct("Margin")
public class Margin {

    private float left;
    private float top;
    private float right;
    private float bottom;

    public Margin() {}

    public Margin(float left, float top, float right, float bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    public static Margin uniform(float v) {
        return new Margin(v, v, v, v);
    }

    public Margin copy() {
        return new Margin(left, top, right, bottom);
    }

    public float getLeft() { return left; }
    public void setLeft(float left) { this.left = left; }
    public float getTop() { return top; }
    public void setTop(float top) { this.top = top; }
    public float getRight() { return right; }
    public void setRight(float right) { this.right = right; }
    public float getBottom() { return bottom; }
    public void setBottom(float bottom) { this.bottom = bottom; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Margin m)) return false;
        return Float.compare(left, m.left) == 0 && Float.compare(top, m.top) == 0
                && Float.compare(right, m.right) == 0 && Float.compare(bottom, m.bottom) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    @Override
    public String toString() {
        return "(Left=" + left + ",Top=" + top + ",Right=" + right + ",Bottom=" + bottom + ")";
    }
}

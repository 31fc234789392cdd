package com.ciro.jprops.types;

import com.ciro.jprops.annotations.Struct;

import java.util.Objects;

/** Color RGBA en espacio lineal, componentes en 0..1. */
@Struct("LinearColor")
public class LinearColor {

    private float r;
    private float g;
    private float b;
    private float a = 1f;

    public LinearColor() {}

    public LinearColor(float r, float g, float b, float a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
    }

    public static LinearColor white() {
        return new LinearColor(1f, 1f, 1f, 1f);
    }

    public LinearColor copy() {
        return new LinearColor(r, g, b, a);
    }

    public float getR() { return r; }
    public void setR(float r) { this.r = r; }
    public float getG() { return g; }
    public void setG(float g) { this.g = g; }
    public float getB() { return b; }
    public void setB(float b) { this.b = b; }
    public float getA() { return a; }
    public void setA(float a) { this.a = a; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearColor c)) return false;
        return Float.compare(r, c.r) == 0 && Float.compare(g, c.g) == 0
                && Float.compare(b, c.b) == 0 && Float.compare(a, c.a) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(r, g, b, a);
    }

    @Override
    public String toString() {
        return "(R=" + r + ",G=" + g + ",B=" + b + ",A=" + a + ")";
    }
}

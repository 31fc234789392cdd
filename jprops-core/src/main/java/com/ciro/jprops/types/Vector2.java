package com.ciro.jprops.types;

import com.ciro.jprops.annotations.Struct;

import java.util.Objects;

@Struct("Vector2D")
public class Vector2 {

    private float x;
    private float y;

    public Vector2() {}

    public Vector2(float x, float y) {
        this.x = x;
        this.y = y;
    }

    public Vector2 copy() {
        return new Vector2(x, y);
    }

    public float getX() { return x; }
    public void setX(float x) { this.x = x; }
    public float getY() { return y; }
    public void setY(float y) { this.y = y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector2 v)) return false;
        return Float.compare(x, v.x) == 0 && Float.compare(y, v.y) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(X=" + x + ",Y=" + y + ")";
    }
}

package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Struct;
import com.ciro.jprops.types.Vector2;

import java.util.Objects;

/** Anclas en fracciones del contenedor (0..1). */
@Struct("Anchors")
public class Anchors {

    private Vector2 minimum = new Vector2(0f, 0f);
    private Vector2 maximum = new Vector2(0f, 0f);

    public Anchors() {}

    public Anchors(Vector2 minimum, Vector2 maximum) {
        this.minimum = minimum;
        this.maximum = maximum;
    }

    public Anchors copy() {
        return new Anchors(minimum.copy(), maximum.copy());
    }

    public Vector2 getMinimum() { return minimum; }
    public void setMinimum(Vector2 minimum) { this.minimum = minimum; }
    public Vector2 getMaximum() { return maximum; }
    public void setMaximum(Vector2 maximum) { this.maximum = maximum; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Anchors a && Objects.equals(minimum, a.minimum) && Objects.equals(maximum, a.maximum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minimum, maximum);
    }
}

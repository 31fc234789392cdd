package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Struct;

/** Reparto del espacio en cajas: automático o proporción de relleno. */
@Struct("SlateChildSize")
public class SlotSize {

    private float value = 1f;
    private SizeRule sizeRule = SizeRule.FILL;

    public SlotSize() {}

    public SlotSize(float value, SizeRule sizeRule) {
        this.value = value;
        this.sizeRule = sizeRule;
    }

    public float getValue() { return value; }
    public void setValue(float value) { this.value = value; }
    public SizeRule getSizeRule() { return sizeRule; }
    public void setSizeRule(SizeRule sizeRule) { this.sizeRule = sizeRule; }
}

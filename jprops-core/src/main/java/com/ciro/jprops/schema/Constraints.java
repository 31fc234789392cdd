package com.ciro.jprops.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Restricciones conocidas del campo; las ausentes van a null y no se serializan. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Constraints(List<String> enumValues,
                          Double min,
                          Double max,
                          Double uiMin,
                          Double uiMax,
                          Integer length) {

    public static final Constraints NONE = new Constraints(null, null, null, null, null, null);

    public boolean isEmpty() {
        return enumValues == null && min == null && max == null
                && uiMin == null && uiMax == null && length == null;
    }

    public Constraints withLength(int n) {
        return new Constraints(enumValues, min, max, uiMin, uiMax, n);
    }
}

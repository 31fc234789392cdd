package com.ciro.jprops.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Descripción autocontenida de una propiedad para el llamador.
 * {@code nestedHint} usa las claves recordType, elementType, keyType y valueType.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchemaReport(String type,
                           boolean editable,
                           Constraints constraints,
                           Map<String, String> nestedHint) {}

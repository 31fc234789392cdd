package com.ciro.jprops;

import com.ciro.jprops.schema.Constraints;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** Resultado de una lectura: el valor más su descripción. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyValue(String type,
                            boolean editable,
                            JsonNode value,
                            Constraints constraints,
                            Map<String, String> nestedHint) {}

package com.ciro.jprops.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Objects;

/**
 * Valor tal como llega del llamador: ausente, texto plano o árbol JSON.
 * El texto plano se distingue del JSON porque los colores aceptan "#FF0000" o "red".
 */
public final class ExternalValue {

    public enum Kind { ABSENT, STRING, NODE }

    private static final ExternalValue ABSENT = new ExternalValue(Kind.ABSENT, null, null);

    private final Kind kind;
    private final String text;
    private final JsonNode node;

    private ExternalValue(Kind kind, String text, JsonNode node) {
        this.kind = kind;
        this.text = text;
        this.node = node;
    }

    public static ExternalValue absent() {
        return ABSENT;
    }

    public static ExternalValue ofString(String text) {
        return text == null ? ABSENT : new ExternalValue(Kind.STRING, text, null);
    }

    /** null o MissingNode cuentan como ausente; NullNode es un valor */
    public static ExternalValue ofNode(JsonNode node) {
        if (node == null || node.isMissingNode()) return ABSENT;
        return new ExternalValue(Kind.NODE, null, node);
    }

    public Kind kind() { return kind; }
    public boolean isAbsent() { return kind == Kind.ABSENT; }
    public boolean isString() { return kind == Kind.STRING; }
    public boolean isNode() { return kind == Kind.NODE; }

    public String text() {
        if (kind != Kind.STRING) throw new IllegalStateException("Not a plain string: " + kind);
        return text;
    }

    public JsonNode node() {
        if (kind != Kind.NODE) throw new IllegalStateException("Not a JSON node: " + kind);
        return node;
    }

    /** Vista como árbol; el texto plano se envuelve en un TextNode */
    public JsonNode toNode() {
        return switch (kind) {
            case ABSENT -> MissingNode.getInstance();
            case STRING -> TextNode.valueOf(text);
            case NODE -> node;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExternalValue v)) return false;
        return kind == v.kind && Objects.equals(text, v.text) && Objects.equals(node, v.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, node);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ABSENT -> "<absent>";
            case STRING -> "'" + text + "'";
            case NODE -> node.toString();
        };
    }
}

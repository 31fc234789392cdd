package com.ciro.jprops.path;

import com.ciro.jprops.PropertyException;

import java.util.ArrayList;
import java.util.List;

/**
 * Convierte texto como {@code "Slot.LayoutData.Offsets"} o {@code "Tags[Primary].Color"}
 * en un {@link PropertyPath}. Es puro: no consulta tipos ni objetos.
 */
public final class PathParser {

    public static final String ATTACHMENT_PREFIX = "Slot";

    private PathParser() {}

    public static PropertyPath parse(String text) {
        if (text == null || text.isBlank()) {
            throw PropertyException.invalidPath("Property path is empty");
        }

        List<String> raw = split(text);
        boolean attachment = false;
        if (ATTACHMENT_PREFIX.equalsIgnoreCase(raw.get(0))) {
            if (raw.size() == 1) {
                throw PropertyException.invalidPath(
                        "'%s' must be followed by a property name (e.g. Slot.Padding)", raw.get(0));
            }
            attachment = true;
            raw = raw.subList(1, raw.size());
        }

        List<Segment> segments = new ArrayList<>(raw.size());
        for (String token : raw) {
            segments.add(parseSegment(token, text));
        }
        return new PropertyPath(attachment, segments);
    }

    // Separa por '.' fuera de corchetes; los puntos dentro de [..] son parte de la clave
    private static List<String> split(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inBracket = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                if (inBracket) {
                    throw PropertyException.invalidPath("Nested '[' in segment '%s' of '%s'", cur + "[", text);
                }
                inBracket = true;
            } else if (c == ']') {
                if (!inBracket) {
                    throw PropertyException.invalidPath("Unmatched ']' in segment '%s' of '%s'", cur + "]", text);
                }
                inBracket = false;
            } else if (c == '.' && !inBracket) {
                out.add(requireNonEmpty(cur.toString(), text));
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }

        if (inBracket) {
            throw PropertyException.invalidPath("Unmatched '[' in segment '%s' of '%s'", cur, text);
        }
        out.add(requireNonEmpty(cur.toString(), text));
        return out;
    }

    private static String requireNonEmpty(String token, String text) {
        if (token.isBlank()) {
            throw PropertyException.invalidPath("Empty segment in '%s'", text);
        }
        return token;
    }

    private static Segment parseSegment(String token, String text) {
        int open = token.indexOf('[');
        if (open < 0) {
            return Segment.plain(token.trim());
        }

        String name = token.substring(0, open).trim();
        if (name.isEmpty()) {
            throw PropertyException.invalidPath("Segment '%s' of '%s' has no field name", token, text);
        }
        int close = token.indexOf(']', open);
        if (close != token.length() - 1) {
            throw PropertyException.invalidPath("Unexpected text after ']' in segment '%s' of '%s'", token, text);
        }
        String inner = token.substring(open + 1, close);
        if (inner.isEmpty()) {
            throw PropertyException.invalidPath("Empty brackets in segment '%s' of '%s'", token, text);
        }

        if (isDigits(inner)) {
            try {
                return Segment.numeric(name, Integer.parseInt(inner));
            } catch (NumberFormatException e) {
                throw PropertyException.invalidPath("Index too large in segment '%s' of '%s'", token, text);
            }
        }
        return Segment.keyed(name, inner);
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}

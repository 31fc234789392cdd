package com.ciro.jprops.path;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ruta ya analizada. Si {@code attachmentRoot} es true, el recorrido empieza en el slot
 * de la entidad y no en la entidad misma ("Slot.Padding").
 */
public record PropertyPath(boolean attachmentRoot, List<Segment> segments) {

    public PropertyPath {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("A property path needs at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public int size() {
        return segments.size();
    }

    public Segment segment(int i) {
        return segments.get(i);
    }

    public Segment last() {
        return segments.get(segments.size() - 1);
    }

    public String text() {
        String body = segments.stream().map(Segment::toString).collect(Collectors.joining("."));
        return attachmentRoot ? PathParser.ATTACHMENT_PREFIX + "." + body : body;
    }

    @Override
    public String toString() {
        return text();
    }
}

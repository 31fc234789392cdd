package com.ciro.jprops.resolve;

import com.ciro.jprops.path.PropertyPath;

/**
 * Dónde está el recorrido al evaluar un segmento.
 * {@code root} es el slot si la ruta empieza por "Slot.", o la propia entidad.
 */
public record ResolutionContext(Object entity, Object root, PropertyPath path, int position) {

    public boolean attachmentRoot() {
        return path.attachmentRoot();
    }

    public boolean isFirst() {
        return position == 0;
    }

    public boolean isLast() {
        return position == path.size() - 1;
    }
}

package com.ciro.jprops.resolve;

public enum SyntheticKind {
    /** Posición de la entidad entre los hijos de su contenedor ("Slot.ChildOrder") */
    SIBLING_ORDER
}

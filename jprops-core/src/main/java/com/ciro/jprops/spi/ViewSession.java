package com.ciro.jprops.spi;

/** Vista abierta sobre un documento (p.ej. un WebSocket del editor). */
public interface ViewSession {
    String getId();
    boolean isOpen();
    void sendText(String json);
    void close();
}

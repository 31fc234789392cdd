package com.ciro.jprops.spi;

/** Receptor de las notificaciones de cambio de un documento. */
public interface ChangeSink {

    /** Cambio estructural: regenerar todo lo que depende del documento */
    void regenerate(Object document);

    void markModified(Object document);

    void refreshViews(Object document);

    ChangeSink NOOP = new ChangeSink() {
        @Override public void regenerate(Object document) { }
        @Override public void markModified(Object document) { }
        @Override public void refreshViews(Object document) { }
    };

    /** Reparte cada notificación a todos, en orden */
    static ChangeSink compose(ChangeSink... sinks) {
        ChangeSink[] all = sinks.clone();
        return new ChangeSink() {
            @Override public void regenerate(Object d) { for (ChangeSink s : all) s.regenerate(d); }
            @Override public void markModified(Object d) { for (ChangeSink s : all) s.markModified(d); }
            @Override public void refreshViews(Object d) { for (ChangeSink s : all) s.refreshViews(d); }
        };
    }
}

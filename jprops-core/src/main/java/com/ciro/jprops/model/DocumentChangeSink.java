package com.ciro.jprops.model;

import com.ciro.jprops.spi.ChangeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Aplica las notificaciones sobre el propio {@link WidgetDocument}. Las vistas las refresca otro sink. */
public class DocumentChangeSink implements ChangeSink {

    private static final Logger log = LoggerFactory.getLogger(DocumentChangeSink.class);

    @Override
    public void regenerate(Object document) {
        if (document instanceof WidgetDocument d) {
            d.regenerate();
            log.debug("Document '{}' regenerated (generation {})", d.getName(), d.getGeneration());
        }
    }

    @Override
    public void markModified(Object document) {
        if (document instanceof WidgetDocument d) d.markModified();
    }

    @Override
    public void refreshViews(Object document) {
        // sin vistas propias
    }
}

package com.ciro.jprops.notify;

import com.ciro.jprops.resolve.ResolvedTarget;
import com.ciro.jprops.spi.ChangeSink;
import com.ciro.jprops.spi.EntityModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tras una mutación correcta decide si el cambio es estructural y avisa al {@link ChangeSink}.
 * Estructural = orden entre hermanos o un campo marcado {@code generative}.
 */
public class MutationNotifier {

    private static final Logger log = LoggerFactory.getLogger(MutationNotifier.class);

    private final EntityModel entities;
    private final ChangeSink sink;

    public MutationNotifier(EntityModel entities, ChangeSink sink) {
        this.entities = entities;
        this.sink = sink;
    }

    public boolean isStructural(ResolvedTarget target) {
        return target.isSynthetic() || (target.isField() && target.descriptor().generative());
    }

    public void notify(Object entity, ResolvedTarget target, boolean structural) {
        Object document = entities.documentOf(entity);
        if (document == null) {
            log.debug("'{}' changed but belongs to no document; nothing to refresh", target.path());
            return;
        }
        if (structural) {
            sink.regenerate(document);
        } else {
            sink.markModified(document);
        }
        sink.refreshViews(document);
    }
}

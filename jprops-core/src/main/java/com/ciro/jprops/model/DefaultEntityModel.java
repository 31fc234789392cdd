package com.ciro.jprops.model;

import com.ciro.jprops.spi.EntityModel;

/** {@link EntityModel} sobre el árbol de {@link Widget}. */
public class DefaultEntityModel implements EntityModel {

    @Override
    public Object attachmentOf(Object entity) {
        return entity instanceof Widget w ? w.getSlot() : null;
    }

    @Override
    public Object documentOf(Object entity) {
        return entity instanceof Widget w ? w.getDocument() : null;
    }

    @Override
    public int siblingIndex(Object entity) {
        PanelWidget parent = parentOf(entity);
        return parent == null ? -1 : parent.getChildIndex((Widget) entity);
    }

    @Override
    public int siblingCount(Object entity) {
        PanelWidget parent = parentOf(entity);
        return parent == null ? 0 : parent.getChildrenCount();
    }

    @Override
    public void moveToIndex(Object entity, int index) {
        PanelWidget parent = parentOf(entity);
        if (parent == null) {
            throw new IllegalStateException(entity + " has no parent panel");
        }
        parent.moveChild((Widget) entity, index);
    }

    private static PanelWidget parentOf(Object entity) {
        if (entity instanceof Widget w && w.getSlot() != null) {
            return w.getSlot().getParent();
        }
        return null;
    }
}

package com.ciro.jprops.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Widget con hijos. El orden de los slots es el orden de dibujo y de layout. */
public abstract class PanelWidget extends Widget {

    private final List<PanelSlot> slots = new ArrayList<>();

    protected PanelWidget(String name) {
        super(name);
    }

    protected abstract PanelSlot createSlot();

    public PanelSlot addChild(Widget child) {
        return insertChildAt(slots.size(), child);
    }

    /** Si el hijo ya estaba en otro panel, se saca de allí primero */
    public PanelSlot insertChildAt(int index, Widget child) {
        PanelSlot old = child.getSlot();
        if (old != null) old.getParent().removeChild(child);

        PanelSlot slot = createSlot();
        slot.bind(this, child);
        slots.add(Math.max(0, Math.min(index, slots.size())), slot);
        return slot;
    }

    public boolean removeChild(Widget child) {
        int i = getChildIndex(child);
        if (i < 0) return false;
        slots.remove(i).unbind();
        return true;
    }

    /** Reordena conservando el slot (y sus propiedades de layout) */
    public void moveChild(Widget child, int index) {
        int from = getChildIndex(child);
        if (from < 0) {
            throw new IllegalArgumentException(child + " is not a child of " + this);
        }
        PanelSlot slot = slots.remove(from);
        slots.add(Math.max(0, Math.min(index, slots.size())), slot);
    }

    public int getChildIndex(Widget child) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).getContent() == child) return i;
        }
        return -1;
    }

    public Widget getChildAt(int index) {
        return slots.get(index).getContent();
    }

    public int getChildrenCount() {
        return slots.size();
    }

    public List<Widget> getChildren() {
        List<Widget> out = new ArrayList<>(slots.size());
        for (PanelSlot s : slots) out.add(s.getContent());
        return Collections.unmodifiableList(out);
    }
}

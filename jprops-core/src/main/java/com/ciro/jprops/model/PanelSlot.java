package com.ciro.jprops.model;

/** Une un widget hijo a su panel; cada tipo de panel tiene su familia de slot. */
public abstract class PanelSlot {

    private PanelWidget parent;
    private Widget content;

    void bind(PanelWidget parent, Widget content) {
        this.parent = parent;
        this.content = content;
        content.attach(this);
    }

    void unbind() {
        if (content != null) content.attach(null);
        this.parent = null;
        this.content = null;
    }

    public PanelWidget getParent() { return parent; }
    public Widget getContent() { return content; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + content + "]";
    }
}

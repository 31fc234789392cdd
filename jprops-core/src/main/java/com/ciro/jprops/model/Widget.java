package com.ciro.jprops.model;

import com.ciro.jprops.annotations.Property;
import com.ciro.jprops.types.LocalizedText;
import com.ciro.jprops.types.Vector2;

/**
 * Nodo del árbol de UI. Los campos {@link Property} son los que el editor puede tocar;
 * el slot y el documento los gestiona el árbol.
 */
public abstract class Widget {

    @Property(category = "Identity", editable = false)
    private final String name;

    @Property(category = "Identity", generative = true, tooltip = "Expose the widget as a document variable")
    private boolean variable;

    @Property(category = "Behavior")
    private Visibility visibility = Visibility.VISIBLE;

    @Property(category = "Behavior")
    private boolean enabled = true;

    @Property(category = "Behavior")
    private LocalizedText toolTipText = LocalizedText.of("");

    @Property(category = "Rendering", clampMin = "0", clampMax = "1", uiMin = "0", uiMax = "1")
    private float renderOpacity = 1f;

    @Property(category = "Rendering")
    private Vector2 renderTransformPivot = new Vector2(0.5f, 0.5f);

    private PanelSlot slot;
    private WidgetDocument document;

    protected Widget(String name) {
        this.name = name;
    }

    public String getName() { return name; }
    public boolean isVariable() { return variable; }
    public void setVariable(boolean variable) { this.variable = variable; }
    public Visibility getVisibility() { return visibility; }
    public void setVisibility(Visibility visibility) { this.visibility = visibility; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public LocalizedText getToolTipText() { return toolTipText; }
    public void setToolTipText(LocalizedText toolTipText) { this.toolTipText = toolTipText; }
    public float getRenderOpacity() { return renderOpacity; }
    public void setRenderOpacity(float renderOpacity) { this.renderOpacity = renderOpacity; }
    public Vector2 getRenderTransformPivot() { return renderTransformPivot; }
    public void setRenderTransformPivot(Vector2 pivot) { this.renderTransformPivot = pivot; }

    /** null si el widget no está dentro de un panel */
    public PanelSlot getSlot() {
        return slot;
    }

    void attach(PanelSlot slot) {
        this.slot = slot;
    }

    /** Documento propio (raíz) o el del panel que lo contiene */
    public WidgetDocument getDocument() {
        if (document != null) return document;
        return slot == null ? null : slot.getParent().getDocument();
    }

    void setDocument(WidgetDocument document) {
        this.document = document;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "'" + name + "'";
    }
}

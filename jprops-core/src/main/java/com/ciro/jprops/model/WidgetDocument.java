package com.ciro.jprops.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Documento editable con un árbol de widgets. Regenerar recalcula lo derivado del árbol:
 * hoy, la lista de widgets expuestos como variables.
 */
public class WidgetDocument {

    private final String name;
    private final Widget root;
    private boolean dirty;
    private int generation;
    private List<String> variables = List.of();

    public WidgetDocument(String name, Widget root) {
        this.name = name;
        this.root = root;
        root.setDocument(this);
        this.variables = collectVariables();
    }

    public String getName() { return name; }
    public Widget getRoot() { return root; }
    public boolean isDirty() { return dirty; }
    public int getGeneration() { return generation; }

    /** Nombres de los widgets con {@code variable = true}, en orden de árbol */
    public List<String> getVariables() {
        return variables;
    }

    public void markModified() {
        dirty = true;
    }

    public void regenerate() {
        dirty = true;
        generation++;
        variables = collectVariables();
    }

    public void markSaved() {
        dirty = false;
    }

    public Optional<Widget> findWidget(String widgetName) {
        return allWidgets().stream().filter(w -> w.getName().equals(widgetName)).findFirst();
    }

    /** Recorrido en profundidad desde la raíz */
    public List<Widget> allWidgets() {
        List<Widget> out = new ArrayList<>();
        collect(root, out);
        return Collections.unmodifiableList(out);
    }

    private static void collect(Widget w, List<Widget> out) {
        out.add(w);
        if (w instanceof PanelWidget p) {
            for (Widget child : p.getChildren()) collect(child, out);
        }
    }

    private List<String> collectVariables() {
        List<String> names = new ArrayList<>();
        for (Widget w : allWidgets()) {
            if (w.isVariable()) names.add(w.getName());
        }
        return List.copyOf(names);
    }

    @Override
    public String toString() {
        return name;
    }
}

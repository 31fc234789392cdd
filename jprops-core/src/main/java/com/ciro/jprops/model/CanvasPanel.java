package com.ciro.jprops.model;

public class CanvasPanel extends PanelWidget {

    public CanvasPanel(String name) {
        super(name);
    }

    @Override
    protected PanelSlot createSlot() {
        return new CanvasPanelSlot();
    }
}

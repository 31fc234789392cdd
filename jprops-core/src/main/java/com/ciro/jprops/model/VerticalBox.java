package com.ciro.jprops.model;

public class VerticalBox extends PanelWidget {

    public VerticalBox(String name) {
        super(name);
    }

    @Override
    protected PanelSlot createSlot() {
        return new VerticalBoxSlot();
    }
}

package com.ciro.jprops.model;

public class HorizontalBox extends PanelWidget {

    public HorizontalBox(String name) {
        super(name);
    }

    @Override
    protected PanelSlot createSlot() {
        return new HorizontalBoxSlot();
    }
}

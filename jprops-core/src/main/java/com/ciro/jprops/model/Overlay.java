package com.ciro.jprops.model;

public class Overlay extends PanelWidget {

    public Overlay(String name) {
        super(name);
    }

    @Override
    protected PanelSlot createSlot() {
        return new OverlaySlot();
    }
}
